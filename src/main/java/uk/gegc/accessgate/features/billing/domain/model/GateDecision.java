package uk.gegc.accessgate.features.billing.domain.model;

public enum GateDecision {
    PROCEED,
    ALREADY_DONE,
    ALREADY_PROCESSING
}
