package com.replifast.backend.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown by the review reply services when an operation is rejected or fails.
 * The kind decides the HTTP status; details are added to the error response body.
 */
public class ReviewWorkflowException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public ReviewWorkflowException(ErrorKind kind, String message) {
        this(kind, message, Collections.emptyMap(), null);
    }

    public ReviewWorkflowException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public ReviewWorkflowException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Collections.emptyMap() : new LinkedHashMap<>(details);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public static ReviewWorkflowException validation(String message) {
        return new ReviewWorkflowException(ErrorKind.VALIDATION, message);
    }

    public static ReviewWorkflowException notFound(String message) {
        return new ReviewWorkflowException(ErrorKind.NOT_FOUND, message);
    }

    public static ReviewWorkflowException forbidden(String message) {
        return new ReviewWorkflowException(ErrorKind.FORBIDDEN, message);
    }

    public static ReviewWorkflowException notFoundOrForbidden() {
        return new ReviewWorkflowException(ErrorKind.NOT_FOUND_OR_FORBIDDEN, "Business not found or access denied");
    }

    public static ReviewWorkflowException planRestricted(String message, String reason, String upgradeUrl) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (reason != null) details.put("reason", reason);
        if (upgradeUrl != null) details.put("upgradeUrl", upgradeUrl);
        return new ReviewWorkflowException(ErrorKind.PLAN_RESTRICTED, message, details);
    }

    public static ReviewWorkflowException invalidTransition(Object from, Object to) {
        return new ReviewWorkflowException(ErrorKind.INVALID_TRANSITION,
                String.format("Cannot move review from %s to %s", from, to),
                Map.of("currentStatus", String.valueOf(from), "requestedStatus", String.valueOf(to)));
    }

    public static ReviewWorkflowException alreadyPosted(Long reviewId) {
        return new ReviewWorkflowException(ErrorKind.ALREADY_POSTED,
                "Reply has already been posted to this review", Map.of("reviewId", reviewId));
    }

    public static ReviewWorkflowException missingExternalId(Long reviewId) {
        return new ReviewWorkflowException(ErrorKind.MISSING_EXTERNAL_ID,
                "Review does not have a Google Review ID and cannot be replied to", Map.of("reviewId", reviewId));
    }
}
