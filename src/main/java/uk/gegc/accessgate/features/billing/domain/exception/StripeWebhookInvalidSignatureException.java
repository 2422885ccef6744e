package uk.gegc.accessgate.features.billing.domain.exception;

/**
 * Thrown when a webhook request has no signature header or its signature does not match the signing secret.
 */
public class StripeWebhookInvalidSignatureException extends RuntimeException {

    public StripeWebhookInvalidSignatureException(String message) {
        super(message);
    }

    public StripeWebhookInvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
