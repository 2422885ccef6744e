package uk.gegc.accessgate.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.accessgate.features.billing.application.OrderLedgerService;
import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;
import uk.gegc.accessgate.features.billing.domain.model.CheckoutCompleted;
import uk.gegc.accessgate.features.billing.domain.model.InvoicePaymentFailed;
import uk.gegc.accessgate.features.billing.domain.model.OrderSnapshot;
import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;
import uk.gegc.accessgate.features.billing.domain.model.StepOutcome;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionDeleted;
import uk.gegc.accessgate.features.billing.domain.model.SubscriptionUpdated;
import uk.gegc.accessgate.features.billing.infra.fulfillment.FulfillmentClient;

import java.time.Clock;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLedgerServiceImpl implements OrderLedgerService {

    static final String PAYMENT_FAILED_STATUS = "payment_failed";

    private final FulfillmentClient fulfillmentClient;
    private final Clock clock;

    @Override
    public OrderSnapshot snapshotOf(BillingEvent event, PlanInfo plan) {
        PlanInfo resolved = plan == null ? PlanInfo.UNKNOWN : plan;
        Long amount = null;
        String currency = null;
        String status = null;
        String priceId = null;

        if (event instanceof CheckoutCompleted checkout) {
            amount = checkout.amountTotal();
            currency = checkout.currency();
            status = checkout.subscriptionStatus() != null ? checkout.subscriptionStatus() : checkout.paymentStatus();
            priceId = checkout.priceId();
        } else if (event instanceof SubscriptionUpdated updated) {
            amount = updated.amount();
            currency = updated.currency();
            status = updated.status();
            priceId = updated.priceId();
        } else if (event instanceof SubscriptionDeleted deleted) {
            status = deleted.status();
            priceId = deleted.priceId();
        } else if (event instanceof InvoicePaymentFailed failed) {
            amount = failed.amountDue();
            currency = failed.currency();
            status = PAYMENT_FAILED_STATUS;
            priceId = failed.priceId();
        }

        return new OrderSnapshot(
                event.eventId(),
                event.eventType(),
                event.customerId(),
                event.email(),
                amount,
                currency,
                status,
                priceId,
                resolved.tier(),
                resolved.planKey(),
                resolved.planName(),
                clock.instant()
        );
    }

    @Override
    public StepOutcome upsert(OrderSnapshot snapshot) {
        try {
            fulfillmentClient.upsertOrder(snapshot);
            log.info("Order snapshot stored for event {} ({})", snapshot.eventId(), snapshot.eventType());
            return StepOutcome.ok(STEP_NAME);
        } catch (RuntimeException e) {
            log.warn("Order snapshot upsert failed for event {}: {}", snapshot.eventId(), e.getMessage());
            return StepOutcome.failed(STEP_NAME, e);
        }
    }
}
