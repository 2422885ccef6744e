package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.OnboardingOutcome;
import uk.gegc.accessgate.features.billing.domain.model.OnboardingRequest;

/**
 * Performs the one-time alias provisioning and credential notification per customer.
 */
public interface OnboardingService {

    String STEP_NAME = "onboarding";
    String MARKER_PREFIX = "onboarded:";

    /**
     * Never throws. The onboarded marker is written only after the whole call chain succeeded,
     * so any {@link OnboardingOutcome#FAILED} is retried by the next qualifying event.
     */
    OnboardingOutcome ensureOnboarded(OnboardingRequest request);
}
