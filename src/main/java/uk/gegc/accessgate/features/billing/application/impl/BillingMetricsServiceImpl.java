package uk.gegc.accessgate.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.accessgate.features.billing.application.BillingMetricsService;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of billing metrics service using Micrometer.
 */
@Slf4j
@Service
public class BillingMetricsServiceImpl implements BillingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter webhookReceivedCounter;
    private final Counter webhookOkCounter;
    private final Counter webhookDuplicateCounter;
    private final Counter webhookIgnoredCounter;
    private final Counter webhookFailedCounter;
    private final Counter gateAbortFailedCounter;
    private final Counter recordsDroppedCounter;

    private final Timer webhookLatencyTimer;

    public BillingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.webhookReceivedCounter = Counter.builder("stripe.webhooks.received")
                .description("Number of Stripe webhooks received")
                .register(meterRegistry);
        this.webhookOkCounter = Counter.builder("stripe.webhooks.ok")
                .description("Number of successful Stripe webhook processing")
                .register(meterRegistry);
        this.webhookDuplicateCounter = Counter.builder("stripe.webhooks.duplicate")
                .description("Number of duplicate or concurrent Stripe webhook deliveries")
                .register(meterRegistry);
        this.webhookIgnoredCounter = Counter.builder("stripe.webhooks.ignored")
                .description("Number of acknowledged Stripe webhooks of unhandled types")
                .register(meterRegistry);
        this.webhookFailedCounter = Counter.builder("stripe.webhooks.failed")
                .description("Number of failed Stripe webhook processing")
                .register(meterRegistry);
        this.gateAbortFailedCounter = Counter.builder("billing.gate.abort_failed")
                .description("Number of idempotency locks that could not be reverted after a failure")
                .register(meterRegistry);
        this.recordsDroppedCounter = Counter.builder("billing.records.dropped")
                .description("Number of customer updates dropped for lack of customer id and email")
                .register(meterRegistry);

        this.webhookLatencyTimer = Timer.builder("stripe.webhooks.latency")
                .description("Stripe webhook processing latency")
                .register(meterRegistry);
    }

    @Override
    public void incrementWebhookReceived(String eventType) {
        log.info("METRIC: stripe.webhooks.received eventType={}", eventType);
        webhookReceivedCounter.increment();
    }

    @Override
    public void incrementWebhookOk(String eventType) {
        log.info("METRIC: stripe.webhooks.ok eventType={}", eventType);
        webhookOkCounter.increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        log.info("METRIC: stripe.webhooks.duplicate eventType={}", eventType);
        webhookDuplicateCounter.increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        log.info("METRIC: stripe.webhooks.ignored eventType={}", eventType);
        webhookIgnoredCounter.increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        log.error("METRIC: stripe.webhooks.failed eventType={}", eventType);
        webhookFailedCounter.increment();
    }

    @Override
    public void incrementWebhookRejected(String reason) {
        log.warn("METRIC: stripe.webhooks.rejected reason={}", reason);
        Counter.builder("stripe.webhooks.rejected")
                .description("Number of Stripe webhooks rejected before processing")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String eventType, long latencyMs) {
        log.info("METRIC: stripe.webhooks.latency eventType={} latencyMs={}", eventType, latencyMs);
        webhookLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void incrementStepFailed(String step, String eventType) {
        log.warn("METRIC: billing.steps.failed step={} eventType={}", step, eventType);
        Counter.builder("billing.steps.failed")
                .description("Number of failed pipeline steps")
                .tag("step", step)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementGateAbortFailed(String eventId) {
        log.error("METRIC: billing.gate.abort_failed eventId={}", eventId);
        gateAbortFailedCounter.increment();
    }

    @Override
    public void incrementOnboarding(OnboardingOutcome outcome) {
        log.info("METRIC: billing.onboarding outcome={}", outcome);
        Counter.builder("billing.onboarding")
                .description("Onboarding dispatch outcomes")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementRecordDropped(String eventType) {
        log.error("METRIC: billing.records.dropped eventType={}", eventType);
        recordsDroppedCounter.increment();
    }
}
