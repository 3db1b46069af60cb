package com.replifast.backend.config;

import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Subscription plan matrix: plan identifier -> feature flags and limits.
 *
 * Defaults are built in. Any single feature or limit of a plan may be overridden under
 * {@code app.plans.entitlements.<plan>.features.*} or {@code .limits.*}; unset values keep the
 * default. A plan that only exists in configuration starts from the most restrictive plan.
 * Unknown or missing plan identifiers resolve to the most restrictive plan, never to a richer one.
 * Resolved entitlements are immutable.
 */
@Configuration
@ConfigurationProperties(prefix = "app.plans")
@Slf4j
public class PlanPolicy {

    public static final String BASIC = "basic";
    public static final String STARTER = "starter";
    public static final String PRO = "pro";
    public static final String PRO_PLUS = "pro-plus";

    public static final int UNLIMITED = -1;

    /**
     * Overrides as bound from configuration. Only read by {@link #init()}.
     */
    @Getter
    @Setter
    private Map<String, PlanOverride> entitlements = new LinkedHashMap<>();

    private Map<String, PlanEntitlement> resolved = Collections.emptyMap();

    @PostConstruct
    public void init() {
        Map<String, PlanEntitlement> merged = new LinkedHashMap<>(defaultEntitlements());
        if (entitlements != null) {
            entitlements.forEach((plan, override) -> {
                String planId = normalize(plan);
                PlanEntitlement base = merged.getOrDefault(planId, PlanEntitlement.mostRestrictive());
                merged.put(planId, override == null ? base : override.applyTo(base));
            });
        }
        resolved = Collections.unmodifiableMap(merged);

        log.info("Initialized plan entitlements: {}", resolved.keySet());
        resolved.forEach((plan, entitlement) ->
                log.info("Plan {}: aiReplies={}, autoApproval={}, {} replies/month, {} bulk actions",
                        plan, entitlement.getFeatures().isAiReplies(), entitlement.getFeatures().isAutoApproval(),
                        entitlement.getLimits().getMaxRepliesPerMonth(), entitlement.getLimits().getMaxBulkActions())
        );
    }

    /**
     * Pure lookup of what a plan allows.
     */
    public PlanEntitlement capabilitiesFor(String planId) {
        PlanEntitlement entitlement = resolved.get(normalize(planId));
        if (entitlement != null) {
            return entitlement;
        }
        log.debug("Unknown plan '{}', resolving to {}", planId, BASIC);
        return resolved.getOrDefault(BASIC, PlanEntitlement.mostRestrictive());
    }

    public Map<String, PlanEntitlement> getEntitlementsView() {
        return resolved;
    }

    static String normalize(String planId) {
        if (planId == null || planId.isBlank()) {
            return BASIC;
        }
        return planId.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static Map<String, PlanEntitlement> defaultEntitlements() {
        Map<String, PlanEntitlement> defaults = new LinkedHashMap<>();

        // BASIC - connected profile, no reply tooling
        defaults.put(BASIC, PlanEntitlement.mostRestrictive());

        // STARTER - AI replies with manual approval
        defaults.put(STARTER, PlanEntitlement.builder()
                .features(PlanFeatures.builder()
                        .reviewSync(true)
                        .aiReplies(true)
                        .bulkOperations(true)
                        .build())
                .limits(PlanLimits.builder()
                        .maxReviewsPerSync(UNLIMITED)
                        .maxBusinesses(1)
                        .maxRepliesPerMonth(200)
                        .syncFrequency(SyncFrequency.MANUAL)
                        .maxBulkActions(10)
                        .build())
                .build());

        // PRO - everything, single location
        defaults.put(PRO, PlanEntitlement.builder()
                .features(PlanFeatures.allEnabled())
                .limits(PlanLimits.builder()
                        .maxReviewsPerSync(UNLIMITED)
                        .maxBusinesses(1)
                        .maxRepliesPerMonth(UNLIMITED)
                        .syncFrequency(SyncFrequency.DAILY)
                        .maxBulkActions(UNLIMITED)
                        .build())
                .build());

        // PRO PLUS - everything, unlimited locations
        defaults.put(PRO_PLUS, PlanEntitlement.builder()
                .features(PlanFeatures.allEnabled())
                .limits(PlanLimits.builder()
                        .maxReviewsPerSync(UNLIMITED)
                        .maxBusinesses(UNLIMITED)
                        .maxRepliesPerMonth(UNLIMITED)
                        .syncFrequency(SyncFrequency.DAILY)
                        .maxBulkActions(UNLIMITED)
                        .build())
                .build());

        return defaults;
    }

    public enum SyncFrequency {
        NEVER, MANUAL, DAILY
    }

    @Value
    @Builder(toBuilder = true)
    public static class PlanEntitlement {
        PlanFeatures features;
        PlanLimits limits;

        public static PlanEntitlement mostRestrictive() {
            return PlanEntitlement.builder()
                    .features(PlanFeatures.builder().build())
                    .limits(PlanLimits.builder()
                            .maxReviewsPerSync(UNLIMITED)
                            .maxBusinesses(1)
                            .maxRepliesPerMonth(0)
                            .syncFrequency(SyncFrequency.NEVER)
                            .maxBulkActions(0)
                            .build())
                    .build();
        }
    }

    @Value
    @Builder(toBuilder = true)
    public static class PlanFeatures {
        boolean reviewSync;
        boolean aiReplies;
        boolean autoApproval;
        boolean customVoice;
        boolean advancedInsights;
        boolean bulkOperations;
        boolean autoSync;

        public static PlanFeatures allEnabled() {
            return PlanFeatures.builder()
                    .reviewSync(true)
                    .aiReplies(true)
                    .autoApproval(true)
                    .customVoice(true)
                    .advancedInsights(true)
                    .bulkOperations(true)
                    .autoSync(true)
                    .build();
        }
    }

    /**
     * Limits; -1 means unlimited, 0 means not allowed.
     */
    @Value
    @Builder(toBuilder = true)
    public static class PlanLimits {
        int maxReviewsPerSync;
        int maxBusinesses;
        int maxRepliesPerMonth;
        SyncFrequency syncFrequency;
        int maxBulkActions;

        public boolean hasUnlimitedReplies() {
            return maxRepliesPerMonth == UNLIMITED;
        }

        public boolean allowsReplies(long postedThisMonth) {
            return hasUnlimitedReplies() || postedThisMonth < maxRepliesPerMonth;
        }

        public boolean allowsBulkActions(int count) {
            return maxBulkActions == UNLIMITED || count <= maxBulkActions;
        }
    }

    // ================================================================
    // CONFIGURATION OVERRIDES
    // ================================================================

    /**
     * Partial plan definition bound from configuration; null means "keep the base value".
     */
    @Data
    public static class PlanOverride {
        private FeatureOverrides features;
        private LimitOverrides limits;

        PlanEntitlement applyTo(PlanEntitlement base) {
            PlanFeatures.PlanFeaturesBuilder mergedFeatures = base.getFeatures().toBuilder();
            if (features != null) {
                apply(features.getReviewSync(), mergedFeatures::reviewSync);
                apply(features.getAiReplies(), mergedFeatures::aiReplies);
                apply(features.getAutoApproval(), mergedFeatures::autoApproval);
                apply(features.getCustomVoice(), mergedFeatures::customVoice);
                apply(features.getAdvancedInsights(), mergedFeatures::advancedInsights);
                apply(features.getBulkOperations(), mergedFeatures::bulkOperations);
                apply(features.getAutoSync(), mergedFeatures::autoSync);
            }

            PlanLimits.PlanLimitsBuilder mergedLimits = base.getLimits().toBuilder();
            if (limits != null) {
                apply(limits.getMaxReviewsPerSync(), mergedLimits::maxReviewsPerSync);
                apply(limits.getMaxBusinesses(), mergedLimits::maxBusinesses);
                apply(limits.getMaxRepliesPerMonth(), mergedLimits::maxRepliesPerMonth);
                apply(limits.getSyncFrequency(), mergedLimits::syncFrequency);
                apply(limits.getMaxBulkActions(), mergedLimits::maxBulkActions);
            }

            return PlanEntitlement.builder()
                    .features(mergedFeatures.build())
                    .limits(mergedLimits.build())
                    .build();
        }

        private static <T> void apply(T value, Consumer<T> setter) {
            if (value != null) {
                setter.accept(value);
            }
        }
    }

    @Data
    public static class FeatureOverrides {
        private Boolean reviewSync;
        private Boolean aiReplies;
        private Boolean autoApproval;
        private Boolean customVoice;
        private Boolean advancedInsights;
        private Boolean bulkOperations;
        private Boolean autoSync;
    }

    @Data
    public static class LimitOverrides {
        private Integer maxReviewsPerSync;
        private Integer maxBusinesses;
        private Integer maxRepliesPerMonth;
        private SyncFrequency syncFrequency;
        private Integer maxBulkActions;
    }
}
