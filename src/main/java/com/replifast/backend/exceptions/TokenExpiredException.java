package com.replifast.backend.exceptions;

/**
 * Thrown when a business's Google refresh token is missing or has been revoked.
 * The owner has to reconnect Google before replies can be posted again.
 */
public class TokenExpiredException extends RuntimeException {

    private final Long businessId;

    public TokenExpiredException(Long businessId, String message) {
        super(message);
        this.businessId = businessId;
    }

    public TokenExpiredException(Long businessId, String message, Throwable cause) {
        super(message, cause);
        this.businessId = businessId;
    }

    public Long getBusinessId() {
        return businessId;
    }
}
