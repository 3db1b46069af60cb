package com.replifast.backend.services;

import com.replifast.backend.config.PlanPolicy;
import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Activity;
import com.replifast.backend.models.ApprovalActor;
import com.replifast.backend.models.ApprovalMode;
import com.replifast.backend.models.Business;
import com.replifast.backend.models.Review;
import com.replifast.backend.models.ReviewStatus;
import com.replifast.backend.repositories.BusinessRepository;
import com.replifast.backend.repositories.ReviewRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Approves drafted replies on the owner's behalf according to the business approval mode.
 * Each review goes through the lifecycle engine as a SYSTEM approval.
 *
 * A request may override the stored mode for one call. Preview and statistics are read-only.
 */
@Service
@Slf4j
public class AutoApprovalService {

    static final int DEFAULT_STATS_DAYS = 30;
    static final int MAX_STATS_DAYS = 365;

    private final BusinessRepository businessRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewLifecycleEngine lifecycleEngine;
    private final PlanEnforcer planEnforcer;
    private final OwnershipGuard ownershipGuard;
    private final ActivityService activityService;
    private final Clock clock;

    public AutoApprovalService(BusinessRepository businessRepository,
                               ReviewRepository reviewRepository,
                               ReviewLifecycleEngine lifecycleEngine,
                               PlanEnforcer planEnforcer,
                               OwnershipGuard ownershipGuard,
                               ActivityService activityService,
                               Clock clock) {
        this.businessRepository = businessRepository;
        this.reviewRepository = reviewRepository;
        this.lifecycleEngine = lifecycleEngine;
        this.planEnforcer = planEnforcer;
        this.ownershipGuard = ownershipGuard;
        this.activityService = activityService;
        this.clock = clock;
    }

    public AutoApprovalResult autoApprove(Long businessId, Long requesterUserId) {
        return autoApprove(businessId, requesterUserId, null);
    }

    /**
     * Approve every drafted review that qualifies under the mode, up to the plan's bulk limit.
     * Reviews beyond the limit are reported as skipped and stay DRAFTED.
     */
    public AutoApprovalResult autoApprove(Long businessId, Long requesterUserId, ApprovalMode modeOverride) {
        Business business = findOwnedBusiness(businessId, requesterUserId);
        planEnforcer.require(planEnforcer.canAutoApprove(business), business);

        ApprovalMode mode = effectiveMode(business, modeOverride);
        if (mode == ApprovalMode.MANUAL) {
            log.info("Business {} uses manual approval, nothing to auto-approve", businessId);
            return AutoApprovalResult.empty(mode);
        }

        List<Review> eligible = reviewRepository.findByBusinessIdAndStatus(businessId, ReviewStatus.DRAFTED).stream()
                .filter(review -> mode.qualifies(review.getRating()))
                .toList();
        if (eligible.isEmpty()) {
            return AutoApprovalResult.empty(mode);
        }

        int maxBulk = planEnforcer.entitlementFor(business).getLimits().getMaxBulkActions();
        List<Review> batch = maxBulk == PlanPolicy.UNLIMITED || eligible.size() <= maxBulk
                ? eligible
                : eligible.subList(0, maxBulk);
        planEnforcer.require(planEnforcer.canBulkApprove(business, batch.size()), business);

        List<String> errors = new ArrayList<>();
        int approved = approveAll(batch, errors);

        int skipped = eligible.size() - approved;
        log.info("Auto-approved {}/{} eligible reviews for business {} ({})",
                approved, eligible.size(), businessId, mode.getDescription());
        recordBatch(businessId, mode, approved, skipped, null);

        return new AutoApprovalResult(mode, eligible.size(), approved, skipped, errors);
    }

    /**
     * Approve an explicit set of reviews. Reviews that are missing, belong to another business
     * or are not drafted are reported as errors; reviews that do not qualify under the mode
     * are skipped. The whole set counts against the plan's bulk limit.
     */
    public AutoApprovalResult approveBatch(Long businessId, Long requesterUserId, List<Long> reviewIds,
                                           ApprovalMode modeOverride) {
        if (reviewIds == null || reviewIds.isEmpty()) {
            throw ReviewWorkflowException.validation("At least one review ID is required");
        }
        Business business = findOwnedBusiness(businessId, requesterUserId);
        planEnforcer.require(planEnforcer.canAutoApprove(business), business);

        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(reviewIds));
        planEnforcer.require(planEnforcer.canBulkApprove(business, ids.size()), business);

        ApprovalMode mode = effectiveMode(business, modeOverride);
        List<String> errors = new ArrayList<>();
        List<Review> qualifying = new ArrayList<>();
        for (Long reviewId : ids) {
            Optional<Review> found = reviewRepository.findWithBusinessById(reviewId)
                    .filter(review -> businessId.equals(review.getBusiness().getId()));
            if (found.isEmpty()) {
                errors.add(String.format("Review %d: Not found", reviewId));
                continue;
            }
            Review review = found.get();
            if (review.getStatus() != ReviewStatus.DRAFTED) {
                errors.add(String.format("Review %d: status is %s, expected DRAFTED", reviewId, review.getStatus()));
                continue;
            }
            if (mode.qualifies(review.getRating())) {
                qualifying.add(review);
            }
        }

        int approved = approveAll(qualifying, errors);
        int skipped = ids.size() - approved;
        log.info("Batch approval for business {}: {}/{} approved ({})",
                businessId, approved, ids.size(), mode.getDescription());
        recordBatch(businessId, mode, approved, skipped, ids);

        return new AutoApprovalResult(mode, qualifying.size(), approved, skipped, errors);
    }

    /**
     * What {@link #autoApprove(Long, Long, ApprovalMode)} would do right now, without writing anything.
     */
    @Transactional(readOnly = true)
    public AutoApprovalPreview preview(Long businessId, Long requesterUserId, ApprovalMode modeOverride) {
        Business business = findOwnedBusiness(businessId, requesterUserId);
        ApprovalMode mode = effectiveMode(business, modeOverride);

        Map<Integer, RatingBreakdown> byRating = new LinkedHashMap<>();
        int[] approve = new int[6];
        int[] skip = new int[6];
        int wouldApprove = 0;
        int wouldSkip = 0;

        for (Review review : reviewRepository.findByBusinessIdAndStatus(businessId, ReviewStatus.DRAFTED)) {
            boolean qualifies = mode.qualifies(review.getRating());
            int rating = review.getRating();
            if (qualifies) {
                wouldApprove++;
            } else {
                wouldSkip++;
            }
            if (rating >= 1 && rating <= 5) {
                if (qualifies) {
                    approve[rating]++;
                } else {
                    skip[rating]++;
                }
            }
        }
        for (int rating = 1; rating <= 5; rating++) {
            byRating.put(rating, new RatingBreakdown(approve[rating], skip[rating]));
        }

        return new AutoApprovalPreview(mode, wouldApprove, wouldSkip, Collections.unmodifiableMap(byRating));
    }

    /**
     * Approval statistics for reviews created in the last {@code days} days.
     */
    @Transactional(readOnly = true)
    public ApprovalStats approvalStats(Long businessId, Long requesterUserId, Integer days) {
        int window = days == null ? DEFAULT_STATS_DAYS : days;
        if (window < 1 || window > MAX_STATS_DAYS) {
            throw ReviewWorkflowException.validation("days must be between 1 and " + MAX_STATS_DAYS);
        }
        Business business = findOwnedBusiness(businessId, requesterUserId);

        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(window);
        List<Review> reviews = reviewRepository.findByBusinessIdCreatedSince(businessId, since);

        long autoApproved = 0;
        long manualApproved = 0;
        long pending = 0;
        for (Review review : reviews) {
            boolean auto = Boolean.TRUE.equals(review.getAutoApproved());
            ReviewStatus status = review.getStatus();
            if (auto) {
                autoApproved++;
            } else if (status == ReviewStatus.APPROVED || status == ReviewStatus.POSTED) {
                manualApproved++;
            }
            if (status == ReviewStatus.PENDING || status == ReviewStatus.DRAFTED) {
                pending++;
            }
        }
        int total = reviews.size();
        int rate = total == 0 ? 0 : (int) Math.round(autoApproved * 100.0 / total);

        return new ApprovalStats(effectiveMode(business, null), window, total, autoApproved, manualApproved,
                pending, rate);
    }

    private int approveAll(List<Review> reviews, List<String> errors) {
        int approved = 0;
        for (Review review : reviews) {
            try {
                lifecycleEngine.approve(review.getId(), null, ApprovalActor.SYSTEM);
                approved++;
            } catch (ReviewWorkflowException e) {
                log.warn("Auto-approval skipped review {}: {}", review.getId(), e.getMessage());
                errors.add(String.format("Review %d: %s", review.getId(), e.getMessage()));
            }
        }
        return approved;
    }

    private void recordBatch(Long businessId, ApprovalMode mode, int approved, int skipped, List<Long> reviewIds) {
        if (approved == 0) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("approved", approved);
        metadata.put("skipped", skipped);
        metadata.put("mode", mode.name());
        if (reviewIds != null) {
            metadata.put("reviewIds", reviewIds);
        }
        activityService.record(businessId, Activity.ActivityType.REPLY_AUTO_APPROVED,
                String.format("Auto-approved %d replies using %s", approved, mode.getDescription()), metadata);
    }

    private Business findOwnedBusiness(Long businessId, Long requesterUserId) {
        if (businessId == null) {
            throw ReviewWorkflowException.validation("Business ID is required");
        }
        Business business = businessRepository.findById(businessId)
                .orElseThrow(ReviewWorkflowException::notFoundOrForbidden);
        if (ownershipGuard.check(business.getUserId(), requesterUserId) == OwnershipGuard.Decision.FORBIDDEN) {
            throw ReviewWorkflowException.notFoundOrForbidden();
        }
        return business;
    }

    private static ApprovalMode effectiveMode(Business business, ApprovalMode modeOverride) {
        if (modeOverride != null) {
            return modeOverride;
        }
        return business.getApprovalMode() == null ? ApprovalMode.MANUAL : business.getApprovalMode();
    }

    public record AutoApprovalResult(ApprovalMode approvalMode, int eligible, int approved, int skipped,
                                     List<String> errors) {

        static AutoApprovalResult empty(ApprovalMode mode) {
            return new AutoApprovalResult(mode, 0, 0, 0, List.of());
        }
    }

    public record RatingBreakdown(int approve, int skip) {
    }

    public record AutoApprovalPreview(ApprovalMode approvalMode, int wouldApprove, int wouldSkip,
                                      Map<Integer, RatingBreakdown> byRating) {
    }

    public record ApprovalStats(ApprovalMode approvalMode, int days, long totalReviews, long autoApproved,
                                long manualApproved, long pending, int autoApprovalRate) {
    }
}
