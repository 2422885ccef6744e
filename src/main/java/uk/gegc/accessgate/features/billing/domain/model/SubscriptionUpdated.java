package uk.gegc.accessgate.features.billing.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * {@code customer.subscription.created} and {@code customer.subscription.updated}.
 */
public record SubscriptionUpdated(
        String eventId,
        String eventType,
        String customerId,
        String subscriptionId,
        String status,
        String priceId,
        Map<String, String> metadata,
        Long amount,
        String currency,
        Instant occurredAt
) implements BillingEvent {

    public static final String CREATED_TYPE = "customer.subscription.created";
    public static final String UPDATED_TYPE = "customer.subscription.updated";

    public SubscriptionUpdated {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String email() {
        return null;
    }
}
