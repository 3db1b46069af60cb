package com.replifast.backend.integrations;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replifast.backend.exceptions.TokenExpiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Google Business Profile reply API.
 *
 * Uses the per-business OAuth client registered in the credential bundle; access tokens
 * are refreshed with that client's id and secret.
 */
@Service
@Slf4j
public class GoogleMyBusinessClient implements PlatformReplyClient {

    @Value("${google.api.base-url:https://mybusiness.googleapis.com/v4}")
    private String reviewsBaseUrl;

    @Value("${google.oauth.token-url:https://oauth2.googleapis.com/token}")
    private String tokenUrl;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public GoogleMyBusinessClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void postReply(String accountId, String locationId, String externalReviewId,
                          String text, String accessToken) throws PlatformIntegrationException {

        String url = String.format("%s/accounts/%s/locations/%s/reviews/%s/reply",
                reviewsBaseUrl, accountId, locationId, externalReviewId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken);

        HttpEntity<Map<String, String>> request = new HttpEntity<>(Map.of("comment", text), headers);

        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.PUT, request, String.class);
            log.debug("Google accepted reply for review {} ({})", externalReviewId, response.getStatusCode());

        } catch (HttpStatusCodeException e) {
            String providerMessage = extractErrorMessage(e);
            log.warn("Google rejected reply for review {}: {} {}", externalReviewId, e.getStatusCode(), providerMessage);
            throw new PlatformIntegrationException(providerMessage, e.getStatusCode(), e);

        } catch (ResourceAccessException e) {
            log.warn("I/O error posting reply for review {}: {}", externalReviewId, e.getMessage());
            throw new PlatformIntegrationException("I/O error calling Google: " + e.getMessage(), e);

        } catch (RestClientException e) {
            log.error("Unexpected error posting reply for review {}", externalReviewId, e);
            throw new PlatformIntegrationException("Reply request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public OAuthTokenResponse refreshAccessToken(Long businessId, String refreshToken, String clientId,
                                                 String clientSecret) throws PlatformIntegrationException {

        if (refreshToken == null || refreshToken.trim().isEmpty()) {
            log.error("No refresh token available for business {}", businessId);
            throw new TokenExpiredException(businessId, "No refresh token available. Please reconnect Google.");
        }

        try {
            log.info("Refreshing Google access token for business {}", businessId);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

            MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
            params.add("client_id", clientId);
            params.add("client_secret", clientSecret);
            params.add("refresh_token", refreshToken);
            params.add("grant_type", "refresh_token");

            HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(params, headers);

            ResponseEntity<Map> response = restTemplate.postForEntity(tokenUrl, request, Map.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null
                    || response.getBody().get("access_token") == null) {
                throw new PlatformIntegrationException("Token refresh returned no access token",
                        response.getStatusCode(), null);
            }

            Map<String, Object> body = response.getBody();

            log.info("Successfully refreshed Google token for business {}", businessId);

            return OAuthTokenResponse.builder()
                    .accessToken((String) body.get("access_token"))
                    .refreshToken((String) body.get("refresh_token"))
                    .expiresIn(body.get("expires_in") instanceof Number n ? n.intValue() : null)
                    .tokenType((String) body.get("token_type"))
                    .scope((String) body.get("scope"))
                    .build();

        } catch (HttpClientErrorException e) {
            // invalid_grant, invalid_client: the stored grant is unusable
            log.error("Google token refresh rejected for business {}: {}", businessId, e.getStatusCode());
            throw new TokenExpiredException(businessId, "Google access has been revoked. Please reconnect.", e);

        } catch (RestClientException e) {
            log.error("Error refreshing Google token for business {}: {}", businessId, e.getMessage());
            HttpStatusCodeException statusError = e instanceof HttpStatusCodeException s ? s : null;
            throw new PlatformIntegrationException("Token refresh error: " + e.getMessage(),
                    statusError == null ? null : statusError.getStatusCode(), e);
        }
    }

    /**
     * Google error bodies look like {"error": {"code": 403, "message": "...", "status": "PERMISSION_DENIED"}}
     */
    private String extractErrorMessage(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body.isBlank()) {
            return e.getStatusText();
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : e.getStatusText();
        } catch (Exception parseError) {
            log.debug("Google error body is not JSON: {}", parseError.getMessage());
            return e.getStatusText();
        }
    }
}
