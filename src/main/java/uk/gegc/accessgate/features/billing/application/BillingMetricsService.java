package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;

/**
 * Service for emitting billing metrics and counters.
 */
public interface BillingMetricsService {

    /**
     * Webhook lifecycle counters.
     */
    void incrementWebhookReceived(String eventType);
    void incrementWebhookOk(String eventType);
    void incrementWebhookDuplicate(String eventType);
    void incrementWebhookIgnored(String eventType);
    void incrementWebhookFailed(String eventType);
    void incrementWebhookRejected(String reason);

    void recordWebhookLatency(String eventType, long latencyMs);

    /**
     * Pipeline health.
     */
    void incrementStepFailed(String step, String eventType);
    void incrementGateAbortFailed(String eventId);
    void incrementOnboarding(OnboardingOutcome outcome);
    void incrementRecordDropped(String eventType);
}
