package com.replifast.backend.dto;

import com.replifast.backend.models.Review;
import com.replifast.backend.models.ReviewStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewReplyDto {
    private Long reviewId;
    private Long businessId;
    private String googleReviewId;
    private Integer rating;
    private ReviewStatus status;
    private String aiReply;
    private String finalReply;
    private Boolean autoApproved;
    private OffsetDateTime postedAt;
    private OffsetDateTime updatedAt;

    public static ReviewReplyDto from(Review review) {
        return ReviewReplyDto.builder()
                .reviewId(review.getId())
                .businessId(review.getBusiness() != null ? review.getBusiness().getId() : null)
                .googleReviewId(review.getGoogleReviewId())
                .rating(review.getRating())
                .status(review.getStatus())
                .aiReply(review.getAiReply())
                .finalReply(review.getFinalReply())
                .autoApproved(review.getAutoApproved())
                .postedAt(review.getPostedAt())
                .updatedAt(review.getUpdatedAt())
                .build();
    }
}
