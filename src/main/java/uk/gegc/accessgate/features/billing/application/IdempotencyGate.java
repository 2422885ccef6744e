package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.GateDecision;

/**
 * Event-level lock keyed by Stripe event id, moving {@code absent -> processing -> done}.
 */
public interface IdempotencyGate {

    String KEY_PREFIX = "event:";

    /**
     * Atomically claims the event with a short-lived {@code processing} entry.
     */
    GateDecision begin(String eventId);

    /**
     * Promotes the entry to {@code done} with the long TTL.
     */
    void commit(String eventId);

    /**
     * Deletes the entry so the next redelivery reprocesses the event.
     * Never throws; a failed delete is logged at ERROR and counted.
     *
     * @return {@code true} if the entry is known to be gone
     */
    boolean abort(String eventId);
}
