package uk.gegc.accessgate.features.billing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings for the fulfillment service (alias issuance, onboarding notification, order ledger).
 */
@Configuration
@ConfigurationProperties(prefix = "fulfillment")
@Data
public class FulfillmentProperties {
    /** Base URL, e.g. {@code https://fulfillment.example.com}. Required for webhook handling. */
    private String baseUrl;

    /** Sent as {@code x-api-key} on every call. Required for webhook handling. */
    private String apiKey;

    /**
     * Sent as {@code x-onboarding-secret} to {@code /onboard-notify}. When absent, onboarding
     * falls back to a single alias call that lets the service send its generic notification.
     */
    private String onboardingSecret;

    private Duration connectTimeout = Duration.ofSeconds(3);

    private Duration readTimeout = Duration.ofSeconds(10);
}
