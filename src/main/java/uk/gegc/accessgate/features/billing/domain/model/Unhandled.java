package uk.gegc.accessgate.features.billing.domain.model;

public record Unhandled(String eventId, String eventType) implements BillingEvent {

    @Override
    public String customerId() {
        return null;
    }

    @Override
    public String email() {
        return null;
    }
}
