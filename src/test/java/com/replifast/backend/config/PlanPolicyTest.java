package com.replifast.backend.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlanPolicyTest {

    private PlanPolicy planPolicy;

    @BeforeEach
    void setUp() {
        planPolicy = new PlanPolicy();
        planPolicy.init();
    }

    @Test
    void capabilitiesFor_UnknownPlan_ShouldResolveToBasic() {
        // When
        PlanPolicy.PlanEntitlement unknown = planPolicy.capabilitiesFor("enterprise-gold");
        PlanPolicy.PlanEntitlement missing = planPolicy.capabilitiesFor(null);

        // Then
        PlanPolicy.PlanEntitlement basic = planPolicy.capabilitiesFor(PlanPolicy.BASIC);
        assertThat(unknown).isEqualTo(basic);
        assertThat(missing).isEqualTo(basic);
        assertThat(unknown.getFeatures().isAiReplies()).isFalse();
        assertThat(unknown.getFeatures().isAutoApproval()).isFalse();
        assertThat(unknown.getLimits().getMaxRepliesPerMonth()).isZero();
    }

    @Test
    void capabilitiesFor_ShouldNormalizeIdentifiers() {
        assertThat(planPolicy.capabilitiesFor("PRO_PLUS")).isEqualTo(planPolicy.capabilitiesFor(PlanPolicy.PRO_PLUS));
        assertThat(planPolicy.capabilitiesFor(" Starter ")).isEqualTo(planPolicy.capabilitiesFor(PlanPolicy.STARTER));
    }

    @Test
    void defaults_ShouldMatchPlanMatrix() {
        PlanPolicy.PlanEntitlement starter = planPolicy.capabilitiesFor(PlanPolicy.STARTER);
        assertThat(starter.getFeatures().isAiReplies()).isTrue();
        assertThat(starter.getFeatures().isAutoApproval()).isFalse();
        assertThat(starter.getLimits().getMaxRepliesPerMonth()).isEqualTo(200);
        assertThat(starter.getLimits().getMaxBulkActions()).isEqualTo(10);

        PlanPolicy.PlanEntitlement pro = planPolicy.capabilitiesFor(PlanPolicy.PRO);
        assertThat(pro.getFeatures().isAutoApproval()).isTrue();
        assertThat(pro.getLimits().hasUnlimitedReplies()).isTrue();
        assertThat(pro.getLimits().getMaxBusinesses()).isEqualTo(1);

        assertThat(planPolicy.capabilitiesFor(PlanPolicy.PRO_PLUS).getLimits().getMaxBusinesses())
                .isEqualTo(PlanPolicy.UNLIMITED);
    }

    @Test
    void init_ShouldApplyConfiguredOverrides() {
        // Given
        PlanPolicy configured = new PlanPolicy();
        PlanPolicy.PlanOverride override = new PlanPolicy.PlanOverride();
        override.setFeatures(new PlanPolicy.FeatureOverrides());
        override.getFeatures().setAutoApproval(true);
        override.setLimits(new PlanPolicy.LimitOverrides());
        override.getLimits().setMaxRepliesPerMonth(50);
        configured.getEntitlements().put("STARTER", override);

        // When
        configured.init();

        // Then
        PlanPolicy.PlanEntitlement starter = configured.capabilitiesFor("starter");
        assertThat(starter.getFeatures().isAutoApproval()).isTrue();
        assertThat(starter.getFeatures().isAiReplies()).isTrue();
        assertThat(starter.getLimits().getMaxRepliesPerMonth()).isEqualTo(50);
        assertThat(starter.getLimits().getMaxBulkActions()).isEqualTo(10);
        assertThat(configured.getEntitlementsView()).containsKeys("basic", "starter", "pro", "pro-plus");
    }

    @Test
    void init_PartialOverrideFromProperties_ShouldKeepRemainingDefaults() {
        // Given
        PlanPolicy configured = new PlanPolicy();
        Binder binder = new Binder(new MapConfigurationPropertySource(
                Map.of("app.plans.entitlements.pro.limits.max-replies-per-month", "50")));
        binder.bind("app.plans", Bindable.ofInstance(configured));

        // When
        configured.init();

        // Then
        PlanPolicy.PlanEntitlement pro = configured.capabilitiesFor(PlanPolicy.PRO);
        assertThat(pro.getLimits().getMaxRepliesPerMonth()).isEqualTo(50);
        assertThat(pro.getLimits().getMaxBulkActions()).isEqualTo(PlanPolicy.UNLIMITED);
        assertThat(pro.getLimits().getSyncFrequency()).isEqualTo(PlanPolicy.SyncFrequency.DAILY);
        assertThat(pro.getFeatures()).isEqualTo(PlanPolicy.PlanFeatures.allEnabled());
    }

    @Test
    void init_PlanOnlyInConfiguration_ShouldStartFromMostRestrictive() {
        // Given
        PlanPolicy configured = new PlanPolicy();
        Binder binder = new Binder(new MapConfigurationPropertySource(
                Map.of("app.plans.entitlements.agency.features.ai-replies", "true")));
        binder.bind("app.plans", Bindable.ofInstance(configured));

        // When
        configured.init();

        // Then
        PlanPolicy.PlanEntitlement agency = configured.capabilitiesFor("agency");
        assertThat(agency.getFeatures().isAiReplies()).isTrue();
        assertThat(agency.getFeatures().isAutoApproval()).isFalse();
        assertThat(agency.getLimits().getMaxRepliesPerMonth()).isZero();
    }

    @Test
    void capabilitiesFor_ResolvedPlansCannotBeChangedByCallers() {
        // Given
        PlanPolicy.PlanEntitlement before = planPolicy.capabilitiesFor(PlanPolicy.BASIC);

        // When
        PlanPolicy.PlanEntitlement elevated = planPolicy.capabilitiesFor("some-unknown-plan").toBuilder()
                .features(PlanPolicy.PlanFeatures.allEnabled())
                .build();
        Throwable mapWrite = catchThrowable(() ->
                planPolicy.getEntitlementsView().put(PlanPolicy.BASIC, elevated));
        planPolicy.getEntitlements().put(PlanPolicy.BASIC, new PlanPolicy.PlanOverride());

        // Then
        assertThat(mapWrite).isInstanceOf(UnsupportedOperationException.class);
        PlanPolicy.PlanEntitlement after = planPolicy.capabilitiesFor(PlanPolicy.BASIC);
        assertThat(after).isEqualTo(before);
        assertThat(after.getFeatures().isAutoApproval()).isFalse();
        assertThat(after.getLimits().getMaxBulkActions()).isZero();
    }

    @Test
    void limits_ShouldTreatMinusOneAsUnlimited() {
        PlanPolicy.PlanLimits limits = PlanPolicy.PlanLimits.builder()
                .maxRepliesPerMonth(PlanPolicy.UNLIMITED)
                .maxBulkActions(3)
                .build();

        assertThat(limits.allowsReplies(1_000_000)).isTrue();
        assertThat(limits.allowsBulkActions(3)).isTrue();
        assertThat(limits.allowsBulkActions(4)).isFalse();
    }
}
