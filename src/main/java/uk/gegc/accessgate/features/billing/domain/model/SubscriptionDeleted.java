package uk.gegc.accessgate.features.billing.domain.model;

import java.time.Instant;
import java.util.Map;

public record SubscriptionDeleted(
        String eventId,
        String customerId,
        String subscriptionId,
        String status,
        String priceId,
        Map<String, String> metadata,
        Instant occurredAt
) implements BillingEvent {

    public static final String TYPE = "customer.subscription.deleted";

    public SubscriptionDeleted {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String eventType() {
        return TYPE;
    }

    @Override
    public String email() {
        return null;
    }
}
