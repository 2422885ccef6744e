package uk.gegc.accessgate.features.billing.domain.model;

import java.util.Map;

/**
 * Fields of a Stripe subscription the reconciliation pipeline needs, detached from the Stripe model.
 */
public record SubscriptionDetails(
        String subscriptionId,
        String customerId,
        String status,
        String priceId,
        Map<String, String> metadata
) {

    public SubscriptionDetails {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
