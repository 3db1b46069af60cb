package com.replifast.backend.exceptions;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Google accepted the reply but the local commit failed. Must be reconciled, never retried automatically.
 */
public class PostedButUnrecordedException extends ReviewWorkflowException {

    private final Long reviewId;
    private final OffsetDateTime postedAt;

    public PostedButUnrecordedException(Long reviewId, OffsetDateTime postedAt, Throwable cause) {
        super(ErrorKind.POSTED_BUT_UNRECORDED,
                "Reply posted to Google but failed to update local database",
                Map.of("reviewId", reviewId, "postedAt", postedAt.toString()),
                cause);
        this.reviewId = reviewId;
        this.postedAt = postedAt;
    }

    public Long getReviewId() {
        return reviewId;
    }

    public OffsetDateTime getPostedAt() {
        return postedAt;
    }
}
