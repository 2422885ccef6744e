package uk.gegc.accessgate.features.billing.application;

import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;

import java.util.Map;

/**
 * Maps a Stripe price and the plan metadata stamped at checkout creation to a tier and plan.
 */
public interface PlanResolver {

    String METADATA_TIER = "tier";
    String METADATA_PLAN_KEY = "planKey";
    String METADATA_PLAN_NAME = "planName";
    String METADATA_NAME = "name";

    /**
     * Metadata wins field by field; the static price table fills whatever metadata leaves out.
     *
     * @return {@link PlanInfo#UNKNOWN} when neither source knows the plan
     */
    PlanInfo resolve(String priceId, Map<String, String> metadata);
}
