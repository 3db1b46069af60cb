package com.replifast.backend.services;

import com.replifast.backend.exceptions.TokenExpiredException;
import com.replifast.backend.integrations.OAuthTokenResponse;
import com.replifast.backend.integrations.PlatformIntegrationException;
import com.replifast.backend.integrations.PlatformReplyClient;
import com.replifast.backend.integrations.PublishErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GoogleReplyPublisherTest {

    private static final Long BUSINESS_ID = 5L;

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private PlatformReplyClient replyClient;

    private GoogleReplyPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new GoogleReplyPublisher(credentialStore, replyClient);
    }

    @Test
    void publish_Success_ShouldCallGoogleOnce() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.success()).isTrue();
        verify(replyClient).postReply("accounts/1", "locations/42", "g1", "Thank you!", "access-token");
        verify(replyClient, never()).refreshAccessToken(any(), any(), any(), any());
    }

    @Test
    void publish_AuthExpired_ShouldRefreshAndRetryExactlyOnce() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());
        doThrow(httpError(HttpStatus.UNAUTHORIZED))
                .when(replyClient).postReply(any(), any(), any(), any(), eq("access-token"));
        when(replyClient.refreshAccessToken(BUSINESS_ID, "refresh-token", "client-id", "client-secret"))
                .thenReturn(OAuthTokenResponse.builder().accessToken("fresh-token").build());

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.success()).isTrue();
        verify(replyClient).postReply("accounts/1", "locations/42", "g1", "Thank you!", "fresh-token");
        verify(replyClient, times(2)).postReply(any(), any(), any(), any(), any());
        assertThat(result.refreshedTokens().getAccessToken()).isEqualTo("fresh-token");
        verify(credentialStore, never()).saveTokens(any(), any(), any());
    }

    @Test
    void publish_StillUnauthorizedAfterRefresh_ShouldNotRetryAgain() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());
        doThrow(httpError(HttpStatus.UNAUTHORIZED)).when(replyClient).postReply(any(), any(), any(), any(), any());
        when(replyClient.refreshAccessToken(any(), any(), any(), any()))
                .thenReturn(OAuthTokenResponse.builder().accessToken("fresh-token").build());

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(PublishErrorCode.CONNECTION_EXPIRED);
        verify(replyClient, times(2)).postReply(any(), any(), any(), any(), any());
        verify(replyClient, times(1)).refreshAccessToken(any(), any(), any(), any());
        assertThat(result.refreshedTokens()).isNotNull();
    }

    @Test
    void publish_RevokedRefreshToken_ShouldReportConnectionExpired() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());
        doThrow(httpError(HttpStatus.UNAUTHORIZED)).when(replyClient).postReply(any(), any(), any(), any(), any());
        when(replyClient.refreshAccessToken(any(), any(), any(), any()))
                .thenThrow(new TokenExpiredException(BUSINESS_ID, "Google access has been revoked. Please reconnect."));

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.errorCode()).isEqualTo(PublishErrorCode.CONNECTION_EXPIRED);
        verify(replyClient, times(1)).postReply(any(), any(), any(), any(), any());
        verify(credentialStore, never()).saveTokens(any(), any(), any());
    }

    @Test
    void storeRefreshedTokens_ShouldSaveTokensCarriedOnResult() {
        // Given
        GoogleReplyPublisher.PublishResult result = new GoogleReplyPublisher.PublishResult(true, "Reply posted", null,
                OAuthTokenResponse.builder().accessToken("fresh-token").refreshToken("rotated-refresh").build());

        // When
        publisher.storeRefreshedTokens(BUSINESS_ID, result);

        // Then
        verify(credentialStore).saveTokens(BUSINESS_ID, "fresh-token", "rotated-refresh");
    }

    @Test
    void storeRefreshedTokens_NothingRefreshed_ShouldNotWrite() {
        // When
        publisher.storeRefreshedTokens(BUSINESS_ID, GoogleReplyPublisher.PublishResult.ok());
        publisher.storeRefreshedTokens(BUSINESS_ID, null);

        // Then
        verifyNoInteractions(credentialStore);
    }

    @Test
    void storeRefreshedTokens_StoreFails_ShouldOnlyLog() {
        // Given
        GoogleReplyPublisher.PublishResult result = new GoogleReplyPublisher.PublishResult(true, "Reply posted", null,
                OAuthTokenResponse.builder().accessToken("fresh-token").build());
        doThrow(new IllegalStateException("db down")).when(credentialStore).saveTokens(any(), any(), any());

        // When / Then
        assertThatCode(() -> publisher.storeRefreshedTokens(BUSINESS_ID, result)).doesNotThrowAnyException();
    }

    @Test
    void publish_ProviderErrors_ShouldBeClassified() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());
        doThrow(httpError(HttpStatus.FORBIDDEN))
                .doThrow(httpError(HttpStatus.TOO_MANY_REQUESTS))
                .doThrow(httpError(HttpStatus.SERVICE_UNAVAILABLE))
                .doThrow(httpError(HttpStatus.NOT_FOUND))
                .when(replyClient).postReply(any(), any(), any(), any(), any());

        // When / Then
        assertThat(publisher.publish(BUSINESS_ID, "g1", "x").errorCode()).isEqualTo(PublishErrorCode.INSUFFICIENT_PERMISSIONS);
        assertThat(publisher.publish(BUSINESS_ID, "g1", "x").errorCode()).isEqualTo(PublishErrorCode.API_RATE_LIMIT);
        assertThat(publisher.publish(BUSINESS_ID, "g1", "x").errorCode()).isEqualTo(PublishErrorCode.API_UNAVAILABLE);
        assertThat(publisher.publish(BUSINESS_ID, "g1", "x").errorCode()).isEqualTo(PublishErrorCode.LOCATION_NOT_FOUND);
        verify(replyClient, never()).refreshAccessToken(any(), any(), any(), any());
    }

    @Test
    void publish_ReadTimeout_ShouldBeOutcomeUnknownAndNotRetryable() throws Exception {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(credentials());
        ResourceAccessException timeout = new ResourceAccessException("I/O error",
                new SocketTimeoutException("Read timed out"));
        doThrow(new PlatformIntegrationException("I/O error calling Google", timeout))
                .when(replyClient).postReply(any(), any(), any(), any(), any());

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.errorCode()).isEqualTo(PublishErrorCode.OUTCOME_UNKNOWN);
        assertThat(result.errorCode().isRetryable()).isFalse();
    }

    @Test
    void publish_NotConnected_ShouldNotCallGoogle() {
        // Given
        when(credentialStore.loadForPublishing(BUSINESS_ID)).thenReturn(
                new CredentialStore.PublishingCredentials("client-id", "client-secret", null, null, null, null));

        // When
        GoogleReplyPublisher.PublishResult result = publisher.publish(BUSINESS_ID, "g1", "Thank you!");

        // Then
        assertThat(result.errorCode()).isEqualTo(PublishErrorCode.NOT_CONNECTED);
        verifyNoInteractions(replyClient);
    }

    private static CredentialStore.PublishingCredentials credentials() {
        return new CredentialStore.PublishingCredentials("client-id", "client-secret", "accounts/1",
                "locations/42", "access-token", "refresh-token");
    }

    private static PlatformIntegrationException httpError(HttpStatus status) {
        return new PlatformIntegrationException(status.getReasonPhrase(), status, null);
    }
}
