package uk.gegc.accessgate.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical access and billing state of one customer, stored as JSON in the keyed store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CustomerRecord {
    private String email;
    private String customerId;
    private String subscriptionId;
    private String subscriptionStatus;
    private String priceId;
    private String tier;
    private String planKey;
    private String planName;
    @Builder.Default
    private AccessState access = AccessState.LOCKED;
    private Instant updatedAt;
    private String lastEventId;
    private String lastEventType;
}
