package com.replifast.backend.integrations;

/**
 * Classified outcome of a failed reply publish to Google Business Profile.
 */
public enum PublishErrorCode {
    NOT_CONNECTED("Google Business Profile is not connected", false),
    CONNECTION_EXPIRED("Google connection has expired. Please reconnect.", false),
    TOKEN_REFRESH_FAILED("Could not refresh Google access. Please reconnect.", false),
    INSUFFICIENT_PERMISSIONS("Google account lacks permission to manage this location", false),
    API_RATE_LIMIT("Google API rate limit reached. Try again in a few minutes.", true),
    LOCATION_NOT_FOUND("Google location or review was not found", false),
    API_UNAVAILABLE("Google API is temporarily unavailable", true),
    NETWORK_ERROR("Could not reach Google", true),
    // Request was sent but no response arrived; the reply may exist on Google
    OUTCOME_UNKNOWN("No response from Google. Check the review on Google before retrying.", false),
    UNKNOWN_ERROR("Unexpected error from Google", true);

    private final String description;
    private final boolean retryable;

    PublishErrorCode(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
