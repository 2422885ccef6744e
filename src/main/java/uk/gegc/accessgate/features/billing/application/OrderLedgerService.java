package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.BillingEvent;
import uk.gegc.accessgate.features.billing.domain.model.OrderSnapshot;
import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;
import uk.gegc.accessgate.features.billing.domain.model.StepOutcome;

/**
 * Forwards normalized transaction snapshots to the fulfillment service ledger.
 */
public interface OrderLedgerService {

    String STEP_NAME = "order-ledger";

    OrderSnapshot snapshotOf(BillingEvent event, PlanInfo plan);

    /**
     * Never throws; the caller decides from its step policy whether a failure aborts the event.
     */
    StepOutcome upsert(OrderSnapshot snapshot);
}
