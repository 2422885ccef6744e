package uk.gegc.accessgate.features.billing.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging context for webhook processing.
 * Provides consistent MDC fields across all pipeline steps of one event.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventId;
    private String eventType;
    private String customerId;
    private String subscriptionId;
    private String priceId;

    /**
     * Set MDC context for structured logging.
     */
    public void setMDC() {
        if (eventId != null) MDC.put("stripe_event_id", eventId);
        if (eventType != null) MDC.put("stripe_event_type", eventType);
        if (customerId != null) MDC.put("stripe_customer_id", customerId);
        if (subscriptionId != null) MDC.put("stripe_subscription_id", subscriptionId);
        if (priceId != null) MDC.put("stripe_price_id", priceId);
    }

    public static void clearMDC() {
        MDC.remove("stripe_event_id");
        MDC.remove("stripe_event_type");
        MDC.remove("stripe_customer_id");
        MDC.remove("stripe_subscription_id");
        MDC.remove("stripe_price_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
