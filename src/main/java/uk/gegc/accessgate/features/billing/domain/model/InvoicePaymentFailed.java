package uk.gegc.accessgate.features.billing.domain.model;

import java.time.Instant;

public record InvoicePaymentFailed(
        String eventId,
        String invoiceId,
        String customerId,
        String email,
        String subscriptionId,
        String priceId,
        Long amountDue,
        String currency,
        Instant occurredAt
) implements BillingEvent {

    public static final String TYPE = "invoice.payment_failed";

    @Override
    public String eventType() {
        return TYPE;
    }
}
