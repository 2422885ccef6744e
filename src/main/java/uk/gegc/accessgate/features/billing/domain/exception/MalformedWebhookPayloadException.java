package uk.gegc.accessgate.features.billing.domain.exception;

/**
 * Thrown when a correctly signed webhook payload cannot be parsed into a Stripe event
 * or its data object cannot be deserialized into the expected type.
 */
public class MalformedWebhookPayloadException extends RuntimeException {

    public MalformedWebhookPayloadException(String message) {
        super(message);
    }

    public MalformedWebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
