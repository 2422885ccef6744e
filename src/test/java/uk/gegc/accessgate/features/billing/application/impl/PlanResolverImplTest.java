package uk.gegc.accessgate.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.accessgate.features.billing.application.BillingProperties;
import uk.gegc.accessgate.features.billing.domain.model.PlanInfo;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PlanResolverImpl")
class PlanResolverImplTest {

    private PlanResolverImpl planResolver;

    @BeforeEach
    void setUp() {
        BillingProperties.Plan pair = new BillingProperties.Plan();
        pair.setPriceId("price_pair");
        pair.setTier("firstflame");
        pair.setPlanKey("firstflame_pair");
        pair.setPlanName("First Flame: Household Pair");

        BillingProperties properties = new BillingProperties();
        properties.setPlans(List.of(pair));
        planResolver = new PlanResolverImpl(properties);
    }

    @Test
    @DisplayName("Known price resolves from the price table")
    void resolvesFromPriceTable() {
        PlanInfo plan = planResolver.resolve("price_pair", Map.of());

        assertThat(plan).isEqualTo(new PlanInfo("firstflame", "firstflame_pair", "First Flame: Household Pair"));
    }

    @Test
    @DisplayName("Unknown price without metadata is unknown")
    void unknownPrice() {
        PlanInfo plan = planResolver.resolve("price_other", null);

        assertThat(plan).isEqualTo(PlanInfo.UNKNOWN);
        assertThat(plan.isKnown()).isFalse();
    }

    @Test
    @DisplayName("Metadata takes precedence over the price table")
    void metadataWins() {
        PlanInfo plan = planResolver.resolve("price_pair", Map.of(
                "tier", "firstflame",
                "planKey", "firstflame_individual",
                "planName", "First Flame: Individual"));

        assertThat(plan.planKey()).isEqualTo("firstflame_individual");
        assertThat(plan.planName()).isEqualTo("First Flame: Individual");
    }

    @Test
    @DisplayName("Partial metadata is completed field by field from the price table")
    void partialMetadataIsCompleted() {
        PlanInfo plan = planResolver.resolve("price_pair", Map.of("planKey", "firstflame_custom"));

        assertThat(plan.tier()).isEqualTo("firstflame");
        assertThat(plan.planKey()).isEqualTo("firstflame_custom");
        assertThat(plan.planName()).isEqualTo("First Flame: Household Pair");
    }

    @Test
    @DisplayName("Metadata alone resolves a plan for an unknown price, using name when planName is absent")
    void metadataOnly() {
        PlanInfo plan = planResolver.resolve(null, Map.of(
                "tier", "firstflame",
                "planKey", "firstflame_pair",
                "name", "First Flame: Household Pair"));

        assertThat(plan).isEqualTo(new PlanInfo("firstflame", "firstflame_pair", "First Flame: Household Pair"));
    }
}
