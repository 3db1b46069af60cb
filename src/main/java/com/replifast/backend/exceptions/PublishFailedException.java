package com.replifast.backend.exceptions;

import com.replifast.backend.integrations.PublishErrorCode;

import java.util.Map;

/**
 * Google rejected or never acknowledged the reply. Local state was not changed.
 */
public class PublishFailedException extends ReviewWorkflowException {

    private final PublishErrorCode errorCode;

    public PublishFailedException(Long reviewId, PublishErrorCode errorCode, String providerMessage) {
        super(ErrorKind.PUBLISH_FAILED,
                "Failed to post reply to Google Business Profile",
                Map.of(
                        "reviewId", reviewId,
                        "code", errorCode.name(),
                        "details", providerMessage == null ? errorCode.getDescription() : providerMessage,
                        "retryable", errorCode.isRetryable()
                ));
        this.errorCode = errorCode;
    }

    public PublishErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * OUTCOME_UNKNOWN publishes may have reached Google, so they are never safe to repeat blindly.
     */
    @Override
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
