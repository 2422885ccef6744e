package uk.gegc.accessgate.features.billing.application.impl;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Event;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.AccessPolicy;
import uk.gegc.accessgate.features.billing.application.BillingMetricsService;
import uk.gegc.accessgate.features.billing.application.CustomerRecordService;
import uk.gegc.accessgate.features.billing.application.EventClassifier;
import uk.gegc.accessgate.features.billing.application.FulfillmentProperties;
import uk.gegc.accessgate.features.billing.application.IdempotencyGate;
import uk.gegc.accessgate.features.billing.application.OnboardingService;
import uk.gegc.accessgate.features.billing.application.OrderLedgerService;
import uk.gegc.accessgate.features.billing.application.PlanResolver;
import uk.gegc.accessgate.features.billing.application.StripeProperties;
import uk.gegc.accessgate.features.billing.application.StripeWebhookService;
import uk.gegc.accessgate.features.billing.application.WebhookLoggingContext;
import uk.gegc.accessgate.features.billing.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.accessgate.features.billing.domain.exception.StrictStepFailedException;
import uk.gegc.accessgate.features.billing.domain.exception.StripeWebhookInvalidSignatureException;
import uk.gegc.accessgate.features.billing.domain.exception.WebhookConfigurationException;
import uk.gegc.accessgate.features.billing.domain.model.AccessState;
import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;
import uk.gegc.accessgate.features.billing.domain.model.CheckoutCompleted;
import uk.gegc.accessgate.features.billing.domain.model.CustomerRecord;
import uk.gegc.accessgate.features.billing.domain.model.CustomerUpdate;
import uk.gegc.accessgate.features.billing.domain.model.GateDecision;
import uk.gegc.accessgate.features.billing.domain.model.InvoicePaymentFailed;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingRequest;
import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;
import uk.gegc.accessgate.features.billing.domain.model.StepOutcome;
import uk.gegc.accessgate.features.billing.domain.model.StepPolicy;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDeleted;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionUpdated;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Event router: authenticates a delivery, claims it at the idempotency gate and runs the
 * reconciliation steps in order, each under its declared {@link StepPolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripeWebhookServiceImpl implements StripeWebhookService {

    static final String CUSTOMER_RECORD_STEP = "customer-record";

    private final StripeProperties stripeProperties;
    private final FulfillmentProperties fulfillmentProperties;
    private final IdempotencyGate idempotencyGate;
    private final EventClassifier eventClassifier;
    private final PlanResolver planResolver;
    private final CustomerRecordService customerRecordService;
    private final OrderLedgerService orderLedgerService;
    private final OnboardingService onboardingService;
    private final BillingMetricsService metricsService;

    @Override
    public Result process(String payload, String signatureHeader) {
        long startTime = System.currentTimeMillis();

        if (!StringUtils.hasText(signatureHeader)) {
            log.warn("Stripe webhook without Stripe-Signature header; rejecting request");
            metricsService.incrementWebhookRejected("missing_signature");
            throw new StripeWebhookInvalidSignatureException("Missing Stripe signature");
        }
        requireConfiguration();

        Event event = authenticate(payload, signatureHeader);
        String eventId = event.getId();
        String type = event.getType();

        metricsService.incrementWebhookReceived(type);

        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventId(eventId)
                .eventType(type)
                .build();

        if (!eventClassifier.isHandled(type)) {
            loggingContext.logInfo(log, "Ignoring Stripe event id={} type={} (not handled)", eventId, type);
            metricsService.incrementWebhookIgnored(type);
            return Result.IGNORED;
        }

        GateDecision decision = idempotencyGate.begin(eventId);
        if (decision != GateDecision.PROCEED) {
            loggingContext.logInfo(log, "Duplicate Stripe event received; id={} type={} state={}", eventId, type, decision);
            metricsService.incrementWebhookDuplicate(type);
            return Result.DUPLICATE;
        }

        loggingContext.logInfo(log, "Processing Stripe webhook event: id={} type={}", eventId, type);
        try {
            BillingEvent billingEvent = eventClassifier.classify(event);
            loggingContext.setCustomerId(billingEvent.customerId());
            loggingContext.setSubscriptionId(subscriptionIdOf(billingEvent));
            loggingContext.setPriceId(priceIdOf(billingEvent));

            runPipeline(billingEvent, loggingContext);

            idempotencyGate.commit(eventId);
            metricsService.incrementWebhookOk(type);
            metricsService.recordWebhookLatency(type, System.currentTimeMillis() - startTime);
            return Result.OK;
        } catch (RuntimeException e) {
            idempotencyGate.abort(eventId);
            metricsService.incrementWebhookFailed(type);
            loggingContext.logError(log, "Failed to process webhook event: id={} type={}", eventId, type, e);
            throw e; // Re-throw so controller returns 500 and Stripe retries
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private void requireConfiguration() {
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(stripeProperties.getWebhookSecret())) {
            missing.add("stripe.webhook-secret");
        }
        if (!StringUtils.hasText(stripeProperties.getSecretKey())) {
            missing.add("stripe.secret-key");
        }
        if (!StringUtils.hasText(fulfillmentProperties.getBaseUrl())) {
            missing.add("fulfillment.base-url");
        }
        if (!StringUtils.hasText(fulfillmentProperties.getApiKey())) {
            missing.add("fulfillment.api-key");
        }
        if (!missing.isEmpty()) {
            log.error("Stripe webhook rejected, configuration incomplete: {}", missing);
            metricsService.incrementWebhookRejected("configuration");
            throw new WebhookConfigurationException(missing);
        }
    }

    private Event authenticate(String payload, String signatureHeader) {
        final Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, stripeProperties.getWebhookSecret(),
                    stripeProperties.getWebhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            metricsService.incrementWebhookRejected("invalid_signature");
            throw new StripeWebhookInvalidSignatureException("Invalid Stripe signature", e);
        } catch (RuntimeException e) {
            log.warn("Signed Stripe webhook payload is not a valid event: {}", e.getMessage());
            metricsService.incrementWebhookRejected("malformed_payload");
            throw new MalformedWebhookPayloadException("Webhook payload is not a valid Stripe event", e);
        }
        if (event == null || !StringUtils.hasText(event.getId())) {
            metricsService.incrementWebhookRejected("malformed_payload");
            throw new MalformedWebhookPayloadException("Webhook payload has no event id");
        }
        return event;
    }

    private void runPipeline(BillingEvent event, WebhookLoggingContext loggingContext) {
        PlanInfo plan = planResolver.resolve(priceIdOf(event), metadataOf(event));
        AccessState access = AccessPolicy.derive(event);
        boolean grantsAccess = event instanceof CheckoutCompleted && access == AccessState.ACTIVE;

        CustomerUpdate update = toCustomerUpdate(event, plan, access);
        AtomicReference<CustomerRecord> merged = new AtomicReference<>();

        PipelineStep recordStep = new PipelineStep(CUSTOMER_RECORD_STEP, StepPolicy.STRICT, () -> {
            customerRecordService.merge(update, event.eventId(), event.eventType()).ifPresent(merged::set);
            return StepOutcome.ok(CUSTOMER_RECORD_STEP);
        });
        PipelineStep ledgerStep = new PipelineStep(OrderLedgerService.STEP_NAME,
                grantsAccess ? StepPolicy.STRICT : StepPolicy.BEST_EFFORT,
                () -> orderLedgerService.upsert(orderLedgerService.snapshotOf(event, plan)));
        PipelineStep onboardingStep = new PipelineStep(OnboardingService.STEP_NAME, StepPolicy.BEST_EFFORT,
                () -> onboard(event, merged.get()));

        // The access grant and its ledger entry must never diverge: ledger first when granting.
        List<PipelineStep> steps = grantsAccess
                ? List.of(ledgerStep, recordStep, onboardingStep)
                : List.of(recordStep, ledgerStep, onboardingStep);

        loggingContext.logInfo(log, "Reconciling event id={} access={} plan={} grantsAccess={}",
                event.eventId(), access, plan.planKey(), grantsAccess);
        for (PipelineStep step : steps) {
            runStep(step, event, loggingContext);
        }
    }

    private void runStep(PipelineStep step, BillingEvent event, WebhookLoggingContext loggingContext) {
        StepOutcome outcome;
        try {
            outcome = step.action().get();
        } catch (RuntimeException e) {
            outcome = StepOutcome.failed(step.name(), e);
        }
        if (outcome.succeeded()) {
            return;
        }

        metricsService.incrementStepFailed(step.name(), event.eventType());
        if (step.policy() == StepPolicy.STRICT) {
            throw new StrictStepFailedException(event.eventId(), step.name(), outcome.error());
        }
        loggingContext.logWarn(log, "Best-effort step {} failed for event {}; continuing: {}",
                step.name(), event.eventId(), outcome.error() != null ? outcome.error().getMessage() : "unknown");
    }

    private StepOutcome onboard(BillingEvent event, CustomerRecord record) {
        if (record == null) {
            metricsService.incrementOnboarding(OnboardingOutcome.NOT_ELIGIBLE);
            return StepOutcome.ok(OnboardingService.STEP_NAME);
        }
        OnboardingOutcome outcome = onboardingService.ensureOnboarded(OnboardingRequest.from(event.eventId(), record));
        metricsService.incrementOnboarding(outcome);
        if (outcome == OnboardingOutcome.FAILED) {
            return StepOutcome.failed(OnboardingService.STEP_NAME,
                    new IllegalStateException("Onboarding incomplete for customer " + record.getCustomerId()));
        }
        return StepOutcome.ok(OnboardingService.STEP_NAME);
    }

    static CustomerUpdate toCustomerUpdate(BillingEvent event, PlanInfo plan, AccessState access) {
        CustomerUpdate.CustomerUpdateBuilder update = CustomerUpdate.builder()
                .customerId(event.customerId())
                .email(event.email())
                .access(access);

        if (event instanceof InvoicePaymentFailed failed) {
            // Confirms the lock only; plan details stay as previously recorded.
            return update.subscriptionId(failed.subscriptionId()).build();
        }

        update.tier(plan.tier())
                .planKey(plan.planKey())
                .planName(plan.planName())
                .priceId(priceIdOf(event))
                .subscriptionId(subscriptionIdOf(event));

        if (event instanceof CheckoutCompleted checkout) {
            update.subscriptionStatus(checkout.subscriptionStatus());
        } else if (event instanceof SubscriptionUpdated updated) {
            update.subscriptionStatus(updated.status());
        } else if (event instanceof SubscriptionDeleted deleted) {
            update.subscriptionStatus(deleted.status());
        }
        return update.build();
    }

    static String priceIdOf(BillingEvent event) {
        if (event instanceof CheckoutCompleted checkout) return checkout.priceId();
        if (event instanceof SubscriptionUpdated updated) return updated.priceId();
        if (event instanceof SubscriptionDeleted deleted) return deleted.priceId();
        if (event instanceof InvoicePaymentFailed failed) return failed.priceId();
        return null;
    }

    static String subscriptionIdOf(BillingEvent event) {
        if (event instanceof CheckoutCompleted checkout) return checkout.subscriptionId();
        if (event instanceof SubscriptionUpdated updated) return updated.subscriptionId();
        if (event instanceof SubscriptionDeleted deleted) return deleted.subscriptionId();
        if (event instanceof InvoicePaymentFailed failed) return failed.subscriptionId();
        return null;
    }

    static Map<String, String> metadataOf(BillingEvent event) {
        if (event instanceof CheckoutCompleted checkout) return checkout.metadata();
        if (event instanceof SubscriptionUpdated updated) return updated.metadata();
        if (event instanceof SubscriptionDeleted deleted) return deleted.metadata();
        return Map.of();
    }

    private record PipelineStep(String name, StepPolicy policy, Supplier<StepOutcome> action) {
    }
}
