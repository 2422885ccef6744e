package uk.gegc.accessgate.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.accessgate.features.billing.application.BillingProperties;
import uk.gegc.accessgate.features.billing.application.PlanResolver;
import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
public class PlanResolverImpl implements PlanResolver {

    private final BillingProperties billingProperties;

    public PlanResolverImpl(BillingProperties billingProperties) {
        this.billingProperties = billingProperties;
    }

    @Override
    public PlanInfo resolve(String priceId, Map<String, String> metadata) {
        Map<String, String> meta = metadata == null ? Map.of() : metadata;
        Optional<BillingProperties.Plan> configured = findPlan(priceId);

        String tier = firstText(meta.get(METADATA_TIER), configured, BillingProperties.Plan::getTier);
        String planKey = firstText(meta.get(METADATA_PLAN_KEY), configured, BillingProperties.Plan::getPlanKey);
        String planNameFromMeta = StringUtils.hasText(meta.get(METADATA_PLAN_NAME))
                ? meta.get(METADATA_PLAN_NAME)
                : meta.get(METADATA_NAME);
        String planName = firstText(planNameFromMeta, configured, BillingProperties.Plan::getPlanName);

        PlanInfo plan = new PlanInfo(tier, planKey, planName);
        if (!plan.isKnown()) {
            log.debug("No plan known for priceId={}", priceId);
            return PlanInfo.UNKNOWN;
        }
        return plan;
    }

    private Optional<BillingProperties.Plan> findPlan(String priceId) {
        if (!StringUtils.hasText(priceId) || billingProperties.getPlans() == null) {
            return Optional.empty();
        }
        return billingProperties.getPlans().stream()
                .filter(plan -> priceId.equals(plan.getPriceId()))
                .findFirst();
    }

    private static String firstText(String metadataValue,
                                    Optional<BillingProperties.Plan> configured,
                                    Function<BillingProperties.Plan, String> field) {
        if (StringUtils.hasText(metadataValue)) {
            return metadataValue.trim();
        }
        return configured.map(field).filter(StringUtils::hasText).orElse(null);
    }
}
