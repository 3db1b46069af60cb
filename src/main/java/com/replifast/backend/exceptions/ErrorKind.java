package com.replifast.backend.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by the credential store, plan gate and review lifecycle.
 * Each kind maps to the HTTP status class returned at the API boundary.
 */
public enum ErrorKind {
    VALIDATION(HttpStatus.BAD_REQUEST, false),
    MISSING_EXTERNAL_ID(HttpStatus.BAD_REQUEST, false),
    FORBIDDEN(HttpStatus.FORBIDDEN, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    NOT_FOUND_OR_FORBIDDEN(HttpStatus.NOT_FOUND, false),
    PLAN_RESTRICTED(HttpStatus.FORBIDDEN, false),
    INVALID_TRANSITION(HttpStatus.CONFLICT, false),
    ALREADY_POSTED(HttpStatus.CONFLICT, false),
    PUBLISH_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, true),
    POSTED_BUT_UNRECORDED(HttpStatus.INTERNAL_SERVER_ERROR, false),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorKind(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Whether a caller may safely repeat the same request.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
