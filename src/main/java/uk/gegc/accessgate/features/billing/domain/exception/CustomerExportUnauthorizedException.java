package uk.gegc.accessgate.features.billing.domain.exception;

public class CustomerExportUnauthorizedException extends RuntimeException {

    public CustomerExportUnauthorizedException(String message) {
        super(message);
    }
}
