package uk.gegc.accessgate.features.billing.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Partial customer record. A {@code null} field means "not carried by this event" and keeps the stored value.
 */
@Value
@Builder
public class CustomerUpdate {
    String customerId;
    String email;
    String subscriptionId;
    String subscriptionStatus;
    String priceId;
    String tier;
    String planKey;
    String planName;
    AccessState access;
}
