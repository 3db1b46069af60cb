package com.replifast.backend.services;

import com.replifast.backend.exceptions.PostedButUnrecordedException;
import com.replifast.backend.exceptions.PublishFailedException;
import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Activity;
import com.replifast.backend.models.ApprovalActor;
import com.replifast.backend.models.Business;
import com.replifast.backend.models.Review;
import com.replifast.backend.models.ReviewStatus;
import com.replifast.backend.repositories.ReviewRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Reply lifecycle of a review: PENDING -> DRAFTED -> APPROVED -> POSTED.
 *
 * Every transition is a conditional update on the expected status. Publishing happens while
 * the review row is locked and before the local commit, so a review is only ever POSTED after
 * Google confirmed the reply, and two requests for one review never both reach Google.
 * A commit failure after a confirmed publish surfaces as {@link PostedButUnrecordedException}.
 * OAuth tokens refreshed during a publish are written after the review lock is released.
 */
@Service
@Slf4j
public class ReviewLifecycleEngine {

    static final String RECONCILIATION_MARKER = "RECONCILIATION REQUIRED";

    private final ReviewRepository reviewRepository;
    private final PlanEnforcer planEnforcer;
    private final OwnershipGuard ownershipGuard;
    private final GoogleReplyPublisher replyPublisher;
    private final ReplyDraftGenerator draftGenerator;
    private final ActivityService activityService;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ReviewLifecycleEngine(ReviewRepository reviewRepository,
                                 PlanEnforcer planEnforcer,
                                 OwnershipGuard ownershipGuard,
                                 GoogleReplyPublisher replyPublisher,
                                 ReplyDraftGenerator draftGenerator,
                                 ActivityService activityService,
                                 TransactionTemplate transactionTemplate,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.reviewRepository = reviewRepository;
        this.planEnforcer = planEnforcer;
        this.ownershipGuard = ownershipGuard;
        this.replyPublisher = replyPublisher;
        this.draftGenerator = draftGenerator;
        this.activityService = activityService;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    // ================================================================
    // DRAFTING
    // ================================================================

    /**
     * PENDING -> DRAFTED with the given text. Used by the sync job and by {@link #generateDraft}.
     */
    public Review recordDraft(Long reviewId, String draftText) {
        String draft = requireText(draftText, "Draft text is required");
        return storeDraft(loadReview(reviewId), draft);
    }

    /**
     * Owner-initiated variant of {@link #recordDraft(Long, String)}.
     */
    public Review recordDraft(Long reviewId, Long requesterUserId, String draftText) {
        String draft = requireText(draftText, "Draft text is required");
        Review review = loadReview(reviewId);
        ownershipGuard.requireOwner(review.getBusiness(), requesterUserId);
        return storeDraft(review, draft);
    }

    /**
     * Generate an AI draft for a pending review and record it.
     */
    public Review generateDraft(Long reviewId, Long requesterUserId) {
        Review review = loadReview(reviewId);
        Business business = review.getBusiness();
        ownershipGuard.requireOwner(business, requesterUserId);
        requireTransition(review, ReviewStatus.DRAFTED);
        planEnforcer.require(planEnforcer.canGenerateDraft(business), business);

        String customInstruction = planEnforcer.canUseCustomVoice(business).isAllowed()
                ? business.getBrandVoiceInstruction()
                : null;
        ReplyDraftGenerator.BrandVoice voice = new ReplyDraftGenerator.BrandVoice(
                business.getName(), business.getBrandVoicePreset(), customInstruction);

        String draft = draftGenerator.generate(review.getReviewText(), review.getRating(),
                review.getCustomerName(), voice);

        return storeDraft(review, requireText(draft, "Draft generator returned no text"));
    }

    private Review storeDraft(Review review, String draft) {
        Business business = review.getBusiness();
        requireTransition(review, ReviewStatus.DRAFTED);
        planEnforcer.require(planEnforcer.canGenerateDraft(business), business);

        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = inTransaction(() -> reviewRepository.markDrafted(review.getId(), draft, now));
        if (updated == 0) {
            throw conflict(review.getId(), ReviewStatus.DRAFTED);
        }

        review.setAiReply(draft);
        review.setStatus(ReviewStatus.DRAFTED);
        review.setUpdatedAt(now);

        meterRegistry.counter("reviews.reply.drafted").increment();
        log.info("Review {} drafted for business {}", review.getId(), business.getId());
        activityService.record(business.getId(), Activity.ActivityType.REPLY_DRAFTED,
                String.format("Reply drafted for %d-star review", review.getRating()),
                Map.of("reviewId", review.getId()));
        return review;
    }

    // ================================================================
    // APPROVAL
    // ================================================================

    /**
     * DRAFTED -> APPROVED. An empty final text approves the AI draft as is.
     * SYSTEM approvals require the autoApproval feature and are flagged as auto-approved.
     */
    public Review approve(Long reviewId, String finalText, ApprovalActor actor) {
        return approveReview(loadReview(reviewId), finalText, actor);
    }

    public Review approveAsOwner(Long reviewId, Long requesterUserId, String finalText) {
        Review review = loadReview(reviewId);
        ownershipGuard.requireOwner(review.getBusiness(), requesterUserId);
        return approveReview(review, finalText, ApprovalActor.USER);
    }

    private Review approveReview(Review review, String finalText, ApprovalActor actor) {
        Business business = review.getBusiness();
        if (actor == ApprovalActor.SYSTEM) {
            planEnforcer.require(planEnforcer.canAutoApprove(business), business);
        }
        if (review.getStatus().isTerminal()) {
            throw ReviewWorkflowException.alreadyPosted(review.getId());
        }
        requireTransition(review, ReviewStatus.APPROVED);

        String text = hasText(finalText) ? finalText.trim() : review.getAiReply();
        if (!hasText(text)) {
            throw ReviewWorkflowException.validation("Reply text is required");
        }

        boolean automatic = actor == ApprovalActor.SYSTEM;
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = inTransaction(() -> reviewRepository.markApproved(review.getId(), text, automatic, now));
        if (updated == 0) {
            throw conflict(review.getId(), ReviewStatus.APPROVED);
        }

        review.setFinalReply(text);
        review.setAutoApproved(automatic);
        review.setStatus(ReviewStatus.APPROVED);
        review.setUpdatedAt(now);

        meterRegistry.counter("reviews.reply.approved", "actor", actor.name()).increment();
        log.info("Review {} approved by {}", review.getId(), actor);
        activityService.record(business.getId(),
                automatic ? Activity.ActivityType.REPLY_AUTO_APPROVED : Activity.ActivityType.REPLY_APPROVED,
                automatic
                        ? String.format("Reply auto-approved (%s)", business.getApprovalMode() == null
                                ? "system" : business.getApprovalMode().getDescription())
                        : "Reply approved",
                Map.of("reviewId", review.getId(), "rating", review.getRating()));
        return review;
    }

    // ================================================================
    // POSTING
    // ================================================================

    /**
     * APPROVED -> POSTED. Google is called first; the review is only marked posted after
     * Google confirmed the reply. replyText, when given, replaces the approved text.
     */
    public Review postReply(Long reviewId, Long requesterUserId, String replyText) {
        Review review = loadReview(reviewId);
        Business business = review.getBusiness();
        ownershipGuard.requireOwner(business, requesterUserId);

        if (!review.isLinkedToGoogle()) {
            throw ReviewWorkflowException.missingExternalId(reviewId);
        }
        if (review.getStatus().isTerminal()) {
            throw ReviewWorkflowException.alreadyPosted(reviewId);
        }
        requireTransition(review, ReviewStatus.POSTED);

        String text = hasText(replyText) ? replyText.trim() : review.getFinalReply();
        if (!hasText(text)) {
            throw ReviewWorkflowException.validation("Reply text is required");
        }

        long postedThisMonth = reviewRepository.countPostedSince(business.getId(), startOfMonth());
        planEnforcer.require(planEnforcer.canPostReply(business, postedThisMonth), business);

        AtomicReference<OffsetDateTime> confirmedAt = new AtomicReference<>();
        AtomicReference<GoogleReplyPublisher.PublishResult> published = new AtomicReference<>();
        try {
            inTransaction(() -> {
                Review locked = reviewRepository.findByIdForUpdate(reviewId)
                        .orElseThrow(() -> ReviewWorkflowException.notFound("Review not found: " + reviewId));
                if (locked.getStatus().isTerminal()) {
                    throw ReviewWorkflowException.alreadyPosted(reviewId);
                }
                requireTransition(locked, ReviewStatus.POSTED);

                publishOrThrow(review, text, published);
                OffsetDateTime postedAt = OffsetDateTime.now(clock);
                confirmedAt.set(postedAt);

                if (reviewRepository.markPosted(reviewId, text, postedAt) != 1) {
                    throw new IllegalStateException("Review " + reviewId + " left APPROVED while it was being published");
                }
                return postedAt;
            });
        } catch (RuntimeException e) {
            throw unrecordedOrRethrow(review, confirmedAt.get(), e);
        } finally {
            storeRefreshedTokens(business, published.get());
        }

        review.setFinalReply(text);
        review.setStatus(ReviewStatus.POSTED);
        review.setPostedAt(confirmedAt.get());
        review.setUpdatedAt(confirmedAt.get());

        meterRegistry.counter("reviews.reply.posted").increment();
        log.info("Reply posted to Google for review {} (business {})", reviewId, business.getId());
        activityService.record(business.getId(), Activity.ActivityType.REPLY_POSTED,
                String.format("Reply posted to Google for %s's review", displayName(review)),
                replyMetadata(review));
        return review;
    }

    /**
     * Replace the text of an already posted reply on Google. The review stays POSTED.
     */
    public Review updateReply(Long reviewId, Long requesterUserId, String newText) {
        String text = requireText(newText, "Reply text is required");
        Review review = loadReview(reviewId);
        Business business = review.getBusiness();
        ownershipGuard.requireOwner(business, requesterUserId);

        if (!review.isLinkedToGoogle()) {
            throw ReviewWorkflowException.missingExternalId(reviewId);
        }
        if (!review.getStatus().isTerminal()) {
            throw ReviewWorkflowException.invalidTransition(review.getStatus(), ReviewStatus.POSTED);
        }
        if (text.equals(review.getFinalReply())) {
            throw ReviewWorkflowException.validation("New reply is identical to the posted reply");
        }

        // Editing does not consume monthly quota, but the plan must include replies at all
        planEnforcer.require(planEnforcer.canPostReply(business, 0), business);

        AtomicReference<OffsetDateTime> confirmedAt = new AtomicReference<>();
        AtomicReference<GoogleReplyPublisher.PublishResult> published = new AtomicReference<>();
        try {
            inTransaction(() -> {
                Review locked = reviewRepository.findByIdForUpdate(reviewId)
                        .orElseThrow(() -> ReviewWorkflowException.notFound("Review not found: " + reviewId));
                if (!locked.getStatus().isTerminal()) {
                    throw ReviewWorkflowException.invalidTransition(locked.getStatus(), ReviewStatus.POSTED);
                }

                publishOrThrow(review, text, published);
                OffsetDateTime updatedAt = OffsetDateTime.now(clock);
                confirmedAt.set(updatedAt);

                if (reviewRepository.updatePostedReply(reviewId, text, updatedAt) != 1) {
                    throw new IllegalStateException("Review " + reviewId + " changed while its reply was being updated");
                }
                return updatedAt;
            });
        } catch (RuntimeException e) {
            throw unrecordedOrRethrow(review, confirmedAt.get(), e);
        } finally {
            storeRefreshedTokens(business, published.get());
        }

        String previous = review.getFinalReply();
        review.setFinalReply(text);
        review.setUpdatedAt(confirmedAt.get());

        meterRegistry.counter("reviews.reply.updated").increment();
        log.info("Reply updated on Google for review {} (business {})", reviewId, business.getId());

        Map<String, Object> metadata = replyMetadata(review);
        metadata.put("previousReply", previous);
        activityService.record(business.getId(), Activity.ActivityType.REPLY_UPDATED,
                String.format("Reply updated on Google for %s's review", displayName(review)), metadata);
        return review;
    }

    private void publishOrThrow(Review review, String text,
                                AtomicReference<GoogleReplyPublisher.PublishResult> published) {
        GoogleReplyPublisher.PublishResult result =
                replyPublisher.publish(review.getBusiness().getId(), review.getGoogleReviewId(), text);
        published.set(result);
        if (!result.success()) {
            meterRegistry.counter("reviews.reply.publish_failed", "code", result.errorCode().name()).increment();
            log.error("Publishing reply for review {} failed [{}]: {}",
                    review.getId(), result.errorCode(), result.message());
            throw new PublishFailedException(review.getId(), result.errorCode(), result.message());
        }
    }

    /**
     * Runs after the publishing transaction has ended, so the token write never holds a
     * second connection next to the locked review row.
     */
    private void storeRefreshedTokens(Business business, GoogleReplyPublisher.PublishResult result) {
        if (result != null && result.refreshedTokens() != null) {
            replyPublisher.storeRefreshedTokens(business.getId(), result);
        }
    }

    /**
     * Google confirmed but nothing was recorded locally: escalate. Otherwise the failure
     * happened before or during the publish and is rethrown as is.
     */
    private RuntimeException unrecordedOrRethrow(Review review, OffsetDateTime confirmedAt, RuntimeException failure) {
        if (confirmedAt == null) {
            return failure;
        }

        meterRegistry.counter("reviews.reply.posted_unrecorded").increment();
        log.error("{}: reply for review {} (Google review {}, business {}) was accepted by Google at {} " +
                        "but the local update failed",
                RECONCILIATION_MARKER, review.getId(), review.getGoogleReviewId(),
                review.getBusiness().getId(), confirmedAt, failure);

        Map<String, Object> metadata = replyMetadata(review);
        metadata.put("postedAt", confirmedAt.toString());
        metadata.put("error", String.valueOf(failure.getMessage()));
        activityService.record(review.getBusiness().getId(), Activity.ActivityType.REPLY_POSTED_UNRECORDED,
                "Reply reached Google but was not recorded; needs reconciliation", metadata);

        return new PostedButUnrecordedException(review.getId(), confirmedAt, failure);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private Review loadReview(Long reviewId) {
        if (reviewId == null) {
            throw ReviewWorkflowException.validation("Review ID is required");
        }
        return reviewRepository.findWithBusinessById(reviewId)
                .orElseThrow(() -> ReviewWorkflowException.notFound("Review not found: " + reviewId));
    }

    private static void requireTransition(Review review, ReviewStatus target) {
        if (!review.getStatus().canTransitionTo(target)) {
            throw ReviewWorkflowException.invalidTransition(review.getStatus(), target);
        }
    }

    /**
     * A conditional update matched no row: another request moved the review first.
     */
    private ReviewWorkflowException conflict(Long reviewId, ReviewStatus target) {
        ReviewStatus current = reviewRepository.findById(reviewId)
                .map(Review::getStatus)
                .orElseThrow(() -> ReviewWorkflowException.notFound("Review not found: " + reviewId));
        if (current == ReviewStatus.POSTED) {
            return ReviewWorkflowException.alreadyPosted(reviewId);
        }
        return ReviewWorkflowException.invalidTransition(current, target);
    }

    private <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    private OffsetDateTime startOfMonth() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC))
                .withDayOfMonth(1)
                .atStartOfDay()
                .atOffset(ZoneOffset.UTC);
    }

    private static Map<String, Object> replyMetadata(Review review) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reviewId", review.getId());
        metadata.put("googleReviewId", review.getGoogleReviewId());
        metadata.put("rating", review.getRating());
        metadata.put("reply", review.getFinalReply());
        return metadata;
    }

    private static String displayName(Review review) {
        return hasText(review.getCustomerName()) ? review.getCustomerName() : "a customer";
    }

    private static String requireText(String value, String message) {
        if (!hasText(value)) {
            throw ReviewWorkflowException.validation(message);
        }
        return value.trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
