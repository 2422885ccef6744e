package uk.gegc.accessgate.features.billing.domain.model;

/**
 * Normalized Stripe event, produced only by the event classifier.
 * Optional provider fields are {@code null} when the event does not carry them.
 */
public sealed interface BillingEvent
        permits CheckoutCompleted, SubscriptionUpdated, InvoicePaymentFailed, SubscriptionDeleted, Unhandled {

    String eventId();

    String eventType();

    String customerId();

    String email();
}
