package com.replifast.backend.services;

import com.replifast.backend.exceptions.CredentialDecryptionException;
import com.replifast.backend.exceptions.TokenExpiredException;
import com.replifast.backend.integrations.GoogleErrorClassifier;
import com.replifast.backend.integrations.OAuthTokenResponse;
import com.replifast.backend.integrations.PlatformIntegrationException;
import com.replifast.backend.integrations.PlatformReplyClient;
import com.replifast.backend.integrations.PublishErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes a reply to Google for a business.
 *
 * An auth-expired rejection triggers one token refresh and exactly one retry. Every failure
 * comes back as a {@link PublishErrorCode}; provider exceptions never escape. A refreshed token
 * is carried on the result and stored by {@link #storeRefreshedTokens} once the caller has
 * released its review lock.
 */
@Service
@Slf4j
public class GoogleReplyPublisher {

    private final CredentialStore credentialStore;
    private final PlatformReplyClient replyClient;

    public GoogleReplyPublisher(CredentialStore credentialStore, PlatformReplyClient replyClient) {
        this.credentialStore = credentialStore;
        this.replyClient = replyClient;
    }

    public PublishResult publish(Long businessId, String externalReviewId, String text) {
        CredentialStore.PublishingCredentials credentials;
        try {
            credentials = credentialStore.loadForPublishing(businessId);
        } catch (CredentialDecryptionException e) {
            log.error("Cannot decrypt Google credentials for business {}: {}", businessId, e.getMessage());
            return PublishResult.failure(PublishErrorCode.NOT_CONNECTED, "Stored Google credentials could not be read");
        }

        if (!credentials.isConnected()) {
            log.warn("Business {} has no usable Google connection", businessId);
            return PublishResult.failure(PublishErrorCode.NOT_CONNECTED, null);
        }

        try {
            replyClient.postReply(credentials.accountId(), credentials.locationId(), externalReviewId,
                    text, credentials.accessToken());
            log.info("Published reply to Google review {} for business {}", externalReviewId, businessId);
            return PublishResult.ok();
        } catch (PlatformIntegrationException e) {
            if (!e.isAuthExpired()) {
                return classified(businessId, externalReviewId, e);
            }
            log.info("Access token rejected for business {}, refreshing", businessId);
        }

        if (!credentials.canRefresh()) {
            return PublishResult.failure(PublishErrorCode.CONNECTION_EXPIRED, null);
        }

        OAuthTokenResponse refreshed;
        try {
            refreshed = replyClient.refreshAccessToken(businessId, credentials.refreshToken(),
                    credentials.clientId(), credentials.clientSecret());
        } catch (TokenExpiredException e) {
            return PublishResult.failure(PublishErrorCode.CONNECTION_EXPIRED, e.getMessage());
        } catch (PlatformIntegrationException e) {
            log.warn("Token refresh failed for business {}: {}", businessId, e.getMessage());
            return PublishResult.failure(PublishErrorCode.TOKEN_REFRESH_FAILED, e.getMessage());
        }

        try {
            replyClient.postReply(credentials.accountId(), credentials.locationId(), externalReviewId,
                    text, refreshed.getAccessToken());
            log.info("Published reply to Google review {} for business {} after token refresh",
                    externalReviewId, businessId);
            return PublishResult.ok().withRefreshedTokens(refreshed);
        } catch (PlatformIntegrationException e) {
            return classified(businessId, externalReviewId, e).withRefreshedTokens(refreshed);
        }
    }

    /**
     * Best-effort write of a token obtained during {@link #publish}. A failure only costs
     * another refresh on the next publish.
     */
    public void storeRefreshedTokens(Long businessId, PublishResult result) {
        if (result == null || result.refreshedTokens() == null) {
            return;
        }
        OAuthTokenResponse tokens = result.refreshedTokens();
        try {
            credentialStore.saveTokens(businessId, tokens.getAccessToken(), tokens.getRefreshToken());
        } catch (RuntimeException e) {
            log.warn("Could not store refreshed token for business {}: {}", businessId, e.getMessage());
        }
    }

    private PublishResult classified(Long businessId, String externalReviewId, PlatformIntegrationException e) {
        PublishErrorCode code = GoogleErrorClassifier.classify(e);
        log.error("Publishing reply to Google review {} for business {} failed: {} ({})",
                externalReviewId, businessId, code, e.getMessage());
        return PublishResult.failure(code, e.getMessage());
    }

    /**
     * Outcome of one publish call.
     */
    public record PublishResult(boolean success, String message, PublishErrorCode errorCode,
                                OAuthTokenResponse refreshedTokens) {

        public static PublishResult ok() {
            return new PublishResult(true, "Reply posted", null, null);
        }

        public static PublishResult failure(PublishErrorCode code, String message) {
            return new PublishResult(false, message == null ? code.getDescription() : message, code, null);
        }

        PublishResult withRefreshedTokens(OAuthTokenResponse tokens) {
            return new PublishResult(success, message, errorCode, tokens);
        }
    }
}
