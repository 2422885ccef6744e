package uk.gegc.accessgate.features.billing.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * {@code checkout.session.completed}. Subscription status and price are resolved by following
 * the subscription reference, or the session line items for one-time payments.
 */
public record CheckoutCompleted(
        String eventId,
        String sessionId,
        String customerId,
        String email,
        String mode,
        String paymentStatus,
        String subscriptionId,
        String subscriptionStatus,
        String priceId,
        Map<String, String> metadata,
        Long amountTotal,
        String currency,
        Instant occurredAt
) implements BillingEvent {

    public static final String TYPE = "checkout.session.completed";

    public CheckoutCompleted {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String eventType() {
        return TYPE;
    }

    /**
     * A checkout not tied to a subscription never receives a later subscription status event.
     */
    public boolean isOneTime() {
        return subscriptionId == null && !"subscription".equals(mode);
    }
}
