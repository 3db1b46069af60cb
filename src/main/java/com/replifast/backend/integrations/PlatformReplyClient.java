package com.replifast.backend.integrations;

/**
 * Interface for review platforms that accept owner replies
 */
public interface PlatformReplyClient {

    /**
     * Create or replace the owner reply on a review.
     */
    void postReply(String accountId, String locationId, String externalReviewId,
                   String text, String accessToken) throws PlatformIntegrationException;

    /**
     * Exchange a refresh token for a new access token.
     *
     * @throws com.replifast.backend.exceptions.TokenExpiredException when the refresh token was revoked
     */
    OAuthTokenResponse refreshAccessToken(Long businessId, String refreshToken, String clientId,
                                          String clientSecret) throws PlatformIntegrationException;
}
