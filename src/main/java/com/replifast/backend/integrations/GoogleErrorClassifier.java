package com.replifast.backend.integrations;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Maps provider failures onto {@link PublishErrorCode}.
 *
 * I/O failures are NETWORK_ERROR only when the request provably never left this host
 * (refused, unresolvable, connect timeout). Anything after that point is OUTCOME_UNKNOWN.
 */
public final class GoogleErrorClassifier {

    private GoogleErrorClassifier() {
    }

    public static PublishErrorCode classify(PlatformIntegrationException e) {
        if (e.getHttpStatus() != null) {
            return classifyStatus(e.getHttpStatus().value());
        }
        return classifyIoFailure(e.getCause());
    }

    static PublishErrorCode classifyStatus(int status) {
        return switch (status) {
            case 401 -> PublishErrorCode.CONNECTION_EXPIRED;
            case 403 -> PublishErrorCode.INSUFFICIENT_PERMISSIONS;
            case 404 -> PublishErrorCode.LOCATION_NOT_FOUND;
            case 429 -> PublishErrorCode.API_RATE_LIMIT;
            default -> status >= 500 ? PublishErrorCode.API_UNAVAILABLE : PublishErrorCode.UNKNOWN_ERROR;
        };
    }

    static PublishErrorCode classifyIoFailure(Throwable failure) {
        if (failure == null) {
            return PublishErrorCode.UNKNOWN_ERROR;
        }
        boolean ioFailure = false;
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConnectException || t instanceof UnknownHostException
                    || t instanceof NoRouteToHostException) {
                return PublishErrorCode.NETWORK_ERROR;
            }
            if (t instanceof SocketTimeoutException) {
                String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
                return message.contains("connect") ? PublishErrorCode.NETWORK_ERROR : PublishErrorCode.OUTCOME_UNKNOWN;
            }
            if (t instanceof java.io.IOException) {
                ioFailure = true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return ioFailure ? PublishErrorCode.OUTCOME_UNKNOWN : PublishErrorCode.UNKNOWN_ERROR;
    }
}
