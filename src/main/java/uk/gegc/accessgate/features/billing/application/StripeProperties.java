package uk.gegc.accessgate.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Stripe configuration properties: keys, webhook verification and client timeouts.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Data
public class StripeProperties {
    /** Secret API key (server-side), used for customer and subscription lookups. */
    private String secretKey;

    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /** Maximum accepted age of a signed webhook timestamp, in seconds. */
    private long webhookToleranceSeconds = 300L;

    /** Overrides the Stripe API base URL, e.g. for a local stub. */
    private String apiBase;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);
}
