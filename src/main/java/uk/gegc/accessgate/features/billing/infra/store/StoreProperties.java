package uk.gegc.accessgate.features.billing.infra.store;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Selects the keyed store implementation.
 */
@Configuration
@ConfigurationProperties(prefix = "accessgate.store")
@Validated
@Data
public class StoreProperties {

    public enum Type { REDIS, MEMORY }

    @NotNull
    private Type type = Type.REDIS;

    /** SCAN batch hint used when listing keys by prefix. */
    @Positive
    private long scanCount = 500;
}
