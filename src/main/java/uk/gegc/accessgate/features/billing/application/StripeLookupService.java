package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDetails;

import java.util.Optional;

/**
 * Read-only Stripe API lookups used while classifying events.
 * Every method degrades to {@link Optional#empty()} on any provider failure or when no API key is configured.
 */
public interface StripeLookupService {

    /** First customer in Stripe's directory with this email. */
    Optional<String> findCustomerIdByEmail(String email);

    Optional<SubscriptionDetails> findSubscription(String subscriptionId);

    /** Price of the first line item of a checkout session, retrieved with {@code expand=line_items}. */
    Optional<String> findSessionPriceId(String sessionId);
}
