package uk.gegc.accessgate.features.billing.domain.exception;

/**
 * Wraps transport and HTTP failures of calls to the fulfillment service.
 */
public class FulfillmentServiceException extends RuntimeException {

    private final String operation;

    public FulfillmentServiceException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public FulfillmentServiceException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
