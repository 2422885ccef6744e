package uk.gegc.accessgate.features.billing.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Billing configuration: idempotency lock lifetimes, record merge retries, export key and the price table.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    @Valid
    @NotNull
    private Idempotency idempotency = new Idempotency();

    /**
     * Attempts of the read-merge-write loop on a customer record before giving up.
     */
    @Positive
    private int mergeMaxAttempts = 5;

    /**
     * Shared key required in the {@code x-export-key} header of the customer export.
     * When unset the export is open.
     */
    private String customerExportKey;

    /**
     * Static price-to-plan table used when an event carries no plan metadata.
     */
    @Valid
    private List<Plan> plans = new ArrayList<>();

    @Data
    public static class Idempotency {
        /** Lifetime of a {@code processing} lock; bounds how long a crashed attempt blocks redelivery. */
        @NotNull
        private Duration processingTtl = Duration.ofMinutes(5);

        /** Lifetime of a {@code done} marker. */
        @NotNull
        private Duration doneTtl = Duration.ofDays(30);
    }

    @Data
    public static class Plan {
        @NotBlank
        private String priceId;
        private String tier;
        private String planKey;
        private String planName;
    }
}
