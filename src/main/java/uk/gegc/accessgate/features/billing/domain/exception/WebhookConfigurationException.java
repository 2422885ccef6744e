package uk.gegc.accessgate.features.billing.domain.exception;

import java.util.List;

/**
 * Thrown before any durable state is touched when a required secret or URL is absent.
 */
public class WebhookConfigurationException extends RuntimeException {

    private final List<String> missingProperties;

    public WebhookConfigurationException(List<String> missingProperties) {
        super("Missing required configuration: " + String.join(", ", missingProperties));
        this.missingProperties = List.copyOf(missingProperties);
    }

    public List<String> getMissingProperties() {
        return missingProperties;
    }
}
