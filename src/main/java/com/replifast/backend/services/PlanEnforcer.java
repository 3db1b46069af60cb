package com.replifast.backend.services;

import com.replifast.backend.config.PlanPolicy;
import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Business;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for enforcing plan entitlements on review reply operations.
 * Every gated transition in the lifecycle asks this class, never the plan matrix directly.
 */
@Service
@Slf4j
public class PlanEnforcer {

    static final String UPGRADE_URL = "/account/billing";

    private final PlanPolicy planPolicy;

    public PlanEnforcer(PlanPolicy planPolicy) {
        this.planPolicy = planPolicy;
    }

    /**
     * Check if business can have AI reply drafts generated or recorded
     */
    public EnforcementResult canGenerateDraft(Business business) {
        PlanPolicy.PlanEntitlement entitlement = entitlementFor(business);
        if (!entitlement.getFeatures().isAiReplies()) {
            return EnforcementResult.blocked(
                    "AI-generated replies are not available on your plan. Upgrade to draft replies automatically.",
                    "AI_REPLIES_NOT_INCLUDED",
                    UPGRADE_URL
            );
        }
        return EnforcementResult.allowed("AI draft generation allowed");
    }

    /**
     * Check if the system may approve replies on the business's behalf
     */
    public EnforcementResult canAutoApprove(Business business) {
        PlanPolicy.PlanEntitlement entitlement = entitlementFor(business);
        if (!entitlement.getFeatures().isAutoApproval()) {
            return EnforcementResult.blocked(
                    "Auto-approval requires a Pro plan or higher.",
                    "AUTO_APPROVAL_NOT_INCLUDED",
                    UPGRADE_URL
            );
        }
        return EnforcementResult.allowed("Auto-approval allowed");
    }

    public EnforcementResult canUseCustomVoice(Business business) {
        PlanPolicy.PlanEntitlement entitlement = entitlementFor(business);
        if (!entitlement.getFeatures().isCustomVoice()) {
            return EnforcementResult.blocked(
                    "Custom brand voice requires a Pro plan or higher.",
                    "CUSTOM_VOICE_NOT_INCLUDED",
                    UPGRADE_URL
            );
        }
        return EnforcementResult.allowed("Custom brand voice allowed");
    }

    /**
     * Check the monthly reply quota.
     *
     * @param postedThisMonth replies already posted since the start of the current UTC month
     */
    public EnforcementResult canPostReply(Business business, long postedThisMonth) {
        PlanPolicy.PlanLimits limits = entitlementFor(business).getLimits();

        if (limits.getMaxRepliesPerMonth() == 0) {
            return EnforcementResult.blocked(
                    "Posting replies to Google is not available on your plan.",
                    "REPLIES_NOT_INCLUDED",
                    UPGRADE_URL
            );
        }

        if (!limits.allowsReplies(postedThisMonth)) {
            return EnforcementResult.blocked(
                    String.format("Monthly reply limit reached (%d/%d). Upgrade your plan to post more replies.",
                            postedThisMonth, limits.getMaxRepliesPerMonth()),
                    "REPLY_LIMIT_EXCEEDED",
                    UPGRADE_URL
            );
        }

        if (limits.hasUnlimitedReplies()) {
            return EnforcementResult.allowed("Reply posting allowed (unlimited)");
        }
        return EnforcementResult.allowed(String.format("Reply posting allowed (%d/%d used)",
                postedThisMonth, limits.getMaxRepliesPerMonth()));
    }

    public EnforcementResult canBulkApprove(Business business, int count) {
        PlanPolicy.PlanEntitlement entitlement = entitlementFor(business);

        if (!entitlement.getFeatures().isBulkOperations()) {
            return EnforcementResult.blocked(
                    "Bulk operations are not available on your plan.",
                    "BULK_OPERATIONS_NOT_INCLUDED",
                    UPGRADE_URL
            );
        }

        if (!entitlement.getLimits().allowsBulkActions(count)) {
            return EnforcementResult.blocked(
                    String.format("Bulk action limit is %d reviews at a time.", entitlement.getLimits().getMaxBulkActions()),
                    "BULK_LIMIT_EXCEEDED",
                    UPGRADE_URL
            );
        }

        return EnforcementResult.allowed("Bulk approval allowed");
    }

    /**
     * Effective plan entitlement of a business (unknown plans resolve to basic)
     */
    public PlanPolicy.PlanEntitlement entitlementFor(Business business) {
        return planPolicy.capabilitiesFor(business.getPlanId());
    }

    /**
     * Throw PLAN_RESTRICTED when the check was blocked.
     */
    public void require(EnforcementResult result, Business business) {
        if (!result.isAllowed()) {
            log.warn("Plan restriction for business {} on plan '{}': {}",
                    business.getId(), business.getPlanId(), result.getReason());
            throw ReviewWorkflowException.planRestricted(result.getMessage(), result.getReason(), result.getUpgradeUrl());
        }
    }

    /**
     * Result of a plan check
     */
    public static class EnforcementResult {
        private final boolean allowed;
        private final String message;
        private final String reason;
        private final String upgradeUrl;

        private EnforcementResult(boolean allowed, String message, String reason, String upgradeUrl) {
            this.allowed = allowed;
            this.message = message;
            this.reason = reason;
            this.upgradeUrl = upgradeUrl;
        }

        public static EnforcementResult allowed(String message) {
            return new EnforcementResult(true, message, null, null);
        }

        public static EnforcementResult blocked(String message, String reason, String upgradeUrl) {
            return new EnforcementResult(false, message, reason, upgradeUrl);
        }

        public boolean isAllowed() { return allowed; }
        public String getMessage() { return message; }
        public String getReason() { return reason; }
        public String getUpgradeUrl() { return upgradeUrl; }
    }
}
