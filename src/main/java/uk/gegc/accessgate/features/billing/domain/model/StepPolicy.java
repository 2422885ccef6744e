package uk.gegc.accessgate.features.billing.domain.model;

/**
 * How the router reacts to a failed pipeline step.
 */
public enum StepPolicy {
    /** Failure aborts the event and reverts the idempotency gate. */
    STRICT,
    /** Failure is logged and counted; the event still completes. */
    BEST_EFFORT
}
