package uk.gegc.accessgate.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Normalized transaction sent to the fulfillment ledger, keyed by the Stripe event id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderSnapshot(
        String eventId,
        String eventType,
        String customerId,
        String email,
        Long amount,
        String currency,
        String status,
        String priceId,
        String tier,
        String planKey,
        String planName,
        Instant timestamp
) {
}
