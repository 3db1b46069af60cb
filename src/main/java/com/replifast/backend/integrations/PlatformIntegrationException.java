package com.replifast.backend.integrations;

import org.springframework.http.HttpStatusCode;

/**
 * Provider call failed. Carries the HTTP status when the provider answered at all.
 */
public class PlatformIntegrationException extends Exception {

    private final HttpStatusCode httpStatus;

    public PlatformIntegrationException(String message) {
        this(message, null, null);
    }

    public PlatformIntegrationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PlatformIntegrationException(String message, HttpStatusCode httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public HttpStatusCode getHttpStatus() {
        return httpStatus;
    }

    public boolean isAuthExpired() {
        return httpStatus != null && httpStatus.value() == 401;
    }
}
