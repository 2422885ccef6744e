package uk.gegc.accessgate.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for feature flags
 */
@Component
@ConfigurationProperties(prefix = "accessgate.features")
public class FeatureFlags {

    private boolean webhooks = true;
    private boolean customerExport = true;

    public boolean isWebhooks() {
        return webhooks;
    }

    public void setWebhooks(boolean webhooks) {
        this.webhooks = webhooks;
    }

    public boolean isCustomerExport() {
        return customerExport;
    }

    public void setCustomerExport(boolean customerExport) {
        this.customerExport = customerExport;
    }
}
