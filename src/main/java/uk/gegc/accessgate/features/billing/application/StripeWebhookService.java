package uk.gegc.accessgate.features.billing.application;

public interface StripeWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * Authenticates, deduplicates and reconciles one Stripe event delivery.
     *
     * @param payload         raw request body, verified before any parsing
     * @param signatureHeader value of the {@code Stripe-Signature} header, may be {@code null}
     */
    Result process(String payload, String signatureHeader);
}
