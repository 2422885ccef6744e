package uk.gegc.accessgate.features.billing.domain.model;

/**
 * Resolved product tier and plan. All fields are {@code null} when the plan is unknown.
 */
public record PlanInfo(String tier, String planKey, String planName) {

    public static final PlanInfo UNKNOWN = new PlanInfo(null, null, null);

    public boolean isKnown() {
        return tier != null || planKey != null || planName != null;
    }
}
