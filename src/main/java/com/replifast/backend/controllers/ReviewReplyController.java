package com.replifast.backend.controllers;

import com.replifast.backend.dto.AutoApproveRequest;
import com.replifast.backend.dto.PostReplyRequest;
import com.replifast.backend.dto.ReviewActionRequest;
import com.replifast.backend.dto.ReviewReplyDto;
import com.replifast.backend.dto.UpdateReplyRequest;
import com.replifast.backend.models.Review;
import com.replifast.backend.services.AutoApprovalService;
import com.replifast.backend.services.ReviewLifecycleEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Review reply lifecycle: drafting, approval and posting to Google.
 * Failures are mapped to status codes by GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
@Slf4j
public class ReviewReplyController {

    private final ReviewLifecycleEngine lifecycleEngine;
    private final AutoApprovalService autoApprovalService;

    /**
     * Generate an AI draft for a pending review
     * POST /api/v1/reviews/{id}/draft
     */
    @PostMapping("/{id}/draft")
    public ResponseEntity<Map<String, Object>> generateDraft(@PathVariable Long id,
                                                            @Valid @RequestBody ReviewActionRequest request) {
        Review review = lifecycleEngine.generateDraft(id, request.getUserId());
        return ResponseEntity.ok(success("Draft generated", review));
    }

    /**
     * Record a draft written elsewhere
     * PUT /api/v1/reviews/{id}/draft
     */
    @PutMapping("/{id}/draft")
    public ResponseEntity<Map<String, Object>> recordDraft(@PathVariable Long id,
                                                          @Valid @RequestBody ReviewActionRequest request) {
        Review review = lifecycleEngine.recordDraft(id, request.getUserId(), request.getText());
        return ResponseEntity.ok(success("Draft saved", review));
    }

    /**
     * POST /api/v1/reviews/{id}/approve
     */
    @PostMapping("/{id}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable Long id,
                                                      @Valid @RequestBody ReviewActionRequest request) {
        Review review = lifecycleEngine.approveAsOwner(id, request.getUserId(), request.getText());
        return ResponseEntity.ok(success("Reply approved", review));
    }

    /**
     * Post the approved reply to Google
     * POST /api/v1/reviews/post-reply
     */
    @PostMapping("/post-reply")
    public ResponseEntity<Map<String, Object>> postReply(@Valid @RequestBody PostReplyRequest request) {
        log.debug("Post reply requested for review {} by user {}", request.getReviewId(), request.getUserId());
        Review review = lifecycleEngine.postReply(request.getReviewId(), request.getUserId(), request.getReplyText());
        return ResponseEntity.ok(success("Reply posted successfully to Google Business Profile", review));
    }

    /**
     * Edit a reply that is already on Google
     * PUT /api/v1/reviews/update-reply
     */
    @PutMapping("/update-reply")
    public ResponseEntity<Map<String, Object>> updateReply(@Valid @RequestBody UpdateReplyRequest request) {
        Review review = lifecycleEngine.updateReply(request.getReviewId(), request.getUserId(), request.getReplyText());
        return ResponseEntity.ok(success("Reply updated successfully on Google Business Profile", review));
    }

    /**
     * Preview, approve a given set, or approve everything eligible
     * POST /api/v1/reviews/auto-approve
     */
    @PostMapping("/auto-approve")
    public ResponseEntity<?> autoApprove(@Valid @RequestBody AutoApproveRequest request) {
        if (request.isPreviewOnly()) {
            return ResponseEntity.ok(autoApprovalService.preview(
                    request.getBusinessId(), request.getUserId(), request.getApprovalMode()));
        }
        if (request.getReviewIds() != null && !request.getReviewIds().isEmpty()) {
            return ResponseEntity.ok(autoApprovalService.approveBatch(
                    request.getBusinessId(), request.getUserId(), request.getReviewIds(), request.getApprovalMode()));
        }
        return ResponseEntity.ok(autoApprovalService.autoApprove(
                request.getBusinessId(), request.getUserId(), request.getApprovalMode()));
    }

    /**
     * Approval statistics and a preview for the current mode
     * GET /api/v1/reviews/auto-approve?businessId=&userId=&days=30
     */
    @GetMapping("/auto-approve")
    public ResponseEntity<Map<String, Object>> approvalStats(@RequestParam Long businessId,
                                                            @RequestParam Long userId,
                                                            @RequestParam(defaultValue = "30") Integer days) {
        AutoApprovalService.ApprovalStats stats = autoApprovalService.approvalStats(businessId, userId, days);
        AutoApprovalService.AutoApprovalPreview preview = autoApprovalService.preview(businessId, userId, null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("approvalMode", stats.approvalMode());
        body.put("statistics", stats);
        body.put("eligibleReviews", preview.wouldApprove());
        body.put("preview", preview);
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> success(String message, Review review) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", message);
        body.put("review", ReviewReplyDto.from(review));
        return body;
    }
}
