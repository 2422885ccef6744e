package uk.gegc.accessgate.features.billing.domain.model;

public enum OnboardingOutcome {
    /** Access not active, or customer id / email still unknown. */
    NOT_ELIGIBLE,
    ALREADY_ONBOARDED,
    /** Alias created and personalised credential notification sent. */
    ONBOARDED,
    /** Onboarding secret absent; the fulfillment service sent its generic notification. */
    ONBOARDED_GENERIC,
    /** Marker left unset; the next qualifying event retries. */
    FAILED
}
