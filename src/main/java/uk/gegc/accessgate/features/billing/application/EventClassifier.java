package uk.gegc.accessgate.features.billing.application;

import com.stripe.model.Event;
import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;

/**
 * Turns a verified Stripe event into the closed {@link BillingEvent} variant set.
 * Downstream steps never see Stripe model types.
 */
public interface EventClassifier {

    boolean isHandled(String eventType);

    /**
     * Missing optional fields come through as {@code null}; provider lookups that fail degrade the same way.
     *
     * @throws uk.gegc.accessgate.features.billing.domain.exception.MalformedWebhookPayloadException
     *         if the event data cannot be deserialized into the type its event type implies
     */
    BillingEvent classify(Event event);
}
