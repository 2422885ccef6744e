package uk.gegc.accessgate.features.billing.domain.model;

public record StepOutcome(String step, boolean succeeded, Exception error) {

    public static StepOutcome ok(String step) {
        return new StepOutcome(step, true, null);
    }

    public static StepOutcome failed(String step, Exception error) {
        return new StepOutcome(step, false, error);
    }
}
