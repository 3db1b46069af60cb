package com.replifast.backend.services;

import com.replifast.backend.dto.GoogleCredentialsDto;
import com.replifast.backend.exceptions.CredentialDecryptionException;
import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Activity;
import com.replifast.backend.models.Business;
import com.replifast.backend.repositories.BusinessRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Encrypted storage of a business's Google credential bundle and OAuth tokens.
 *
 * Owner-facing operations collapse "no such business" and "not your business" into one
 * NOT_FOUND_OR_FORBIDDEN answer. Callers must not invoke {@link #saveTokens} while holding
 * a review lock; the lifecycle engine writes refreshed tokens after its transaction ends.
 */
@Service
@Slf4j
public class CredentialStore {

    static final String CLIENT_ID = "clientId";
    static final String CLIENT_SECRET = "clientSecret";
    static final String ACCOUNT_ID = "accountId";
    static final String LOCATION_ID = "locationId";
    static final String ACCESS_TOKEN = "accessToken";
    static final String REFRESH_TOKEN = "refreshToken";

    private static final List<String> BUNDLE_FIELDS = List.of(CLIENT_ID, CLIENT_SECRET, ACCOUNT_ID, LOCATION_ID);
    private static final List<String> ALL_FIELDS =
            List.of(CLIENT_ID, CLIENT_SECRET, ACCOUNT_ID, LOCATION_ID, ACCESS_TOKEN, REFRESH_TOKEN);

    private final BusinessRepository businessRepository;
    private final FieldCipher fieldCipher;
    private final OwnershipGuard ownershipGuard;
    private final ActivityService activityService;
    private final Clock clock;

    public CredentialStore(BusinessRepository businessRepository,
                           FieldCipher fieldCipher,
                           OwnershipGuard ownershipGuard,
                           ActivityService activityService,
                           Clock clock) {
        this.businessRepository = businessRepository;
        this.fieldCipher = fieldCipher;
        this.ownershipGuard = ownershipGuard;
        this.activityService = activityService;
        this.clock = clock;
    }

    /**
     * Decrypted credential bundle for the owner, or only the presence flags when none is stored.
     *
     * Reads degrade instead of failing: legacy plaintext is returned as stored, and a field that
     * cannot be decrypted (e.g. written under a key this process no longer has) comes back null
     * and is listed in {@code unreadableFields}.
     */
    @Transactional(readOnly = true)
    public CredentialsView getCredentials(Long businessId, Long requesterUserId) {
        Business business = findOwned(businessId, requesterUserId);

        if (!business.hasCredentialBundle()) {
            return CredentialsView.empty(business.hasTokens());
        }

        Map<String, String> stored = storedValues(business);
        Map<String, String> readable = new HashMap<>();
        List<String> plaintext = new ArrayList<>();
        List<String> unreadable = new ArrayList<>();

        for (String field : BUNDLE_FIELDS) {
            try {
                FieldCipher.DecryptionResult result = fieldCipher.decrypt(stored.get(field));
                if (!result.isDecrypted()) {
                    plaintext.add(field);
                }
                readable.put(field, result.value());
            } catch (CredentialDecryptionException e) {
                log.warn("Cannot decrypt {} of business {}, returning it as unreadable: {}",
                        field, businessId, e.getMessage());
                unreadable.add(field);
            }
        }

        if (!plaintext.isEmpty()) {
            log.warn("Business {} has unencrypted credential fields {}; they will be encrypted on next save",
                    businessId, plaintext);
        }

        GoogleCredentialsDto credentials = GoogleCredentialsDto.builder()
                .clientId(readable.get(CLIENT_ID))
                .clientSecret(readable.get(CLIENT_SECRET))
                .accountId(readable.get(ACCOUNT_ID))
                .locationId(readable.get(LOCATION_ID))
                .build();

        return new CredentialsView(true, business.hasTokens(), !unreadable.isEmpty(), unreadable, credentials);
    }

    /**
     * Validate, encrypt and store the complete bundle in one conditional update.
     */
    @Transactional
    public void saveCredentials(Long businessId, Long requesterUserId, GoogleCredentialsDto credentials) {
        Map<String, String> plain = new HashMap<>();
        plain.put(CLIENT_ID, trimmed(credentials == null ? null : credentials.getClientId()));
        plain.put(CLIENT_SECRET, trimmed(credentials == null ? null : credentials.getClientSecret()));
        plain.put(ACCOUNT_ID, trimmed(credentials == null ? null : credentials.getAccountId()));
        plain.put(LOCATION_ID, trimmed(credentials == null ? null : credentials.getLocationId()));

        List<String> missing = new ArrayList<>();
        for (String field : BUNDLE_FIELDS) {
            if (plain.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw ReviewWorkflowException.validation("All credential fields are required. Missing: " + String.join(", ", missing));
        }

        Map<String, String> encrypted = fieldCipher.encryptFields(plain, BUNDLE_FIELDS);

        int updated = businessRepository.updateCredentialBundle(
                businessId,
                requesterUserId,
                encrypted.get(CLIENT_ID),
                encrypted.get(CLIENT_SECRET),
                encrypted.get(ACCOUNT_ID),
                encrypted.get(LOCATION_ID),
                OffsetDateTime.now(clock));

        if (updated == 0) {
            throw ReviewWorkflowException.notFoundOrForbidden();
        }

        log.info("Stored encrypted Google credentials for business {}", businessId);
        activityService.record(businessId, Activity.ActivityType.CREDENTIALS_SAVED,
                "Google Business Profile credentials updated", Map.of("userId", requesterUserId));
    }

    /**
     * Remove the credential bundle and tokens together.
     */
    @Transactional
    public void disconnect(Long businessId, Long requesterUserId) {
        int updated = businessRepository.clearGoogleConnection(businessId, requesterUserId, OffsetDateTime.now(clock));

        if (updated == 0) {
            throw ReviewWorkflowException.notFoundOrForbidden();
        }

        log.info("Disconnected Google Business Profile for business {}", businessId);
        activityService.record(businessId, Activity.ActivityType.CREDENTIALS_REMOVED,
                "Google Business Profile disconnected", Map.of("userId", requesterUserId));
    }

    /**
     * Store OAuth tokens encrypted. A null refresh token keeps the stored one.
     */
    @Transactional
    public void saveTokens(Long businessId, String accessToken, String refreshToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw ReviewWorkflowException.validation("Access token is required");
        }

        Business business = businessRepository.findById(businessId)
                .orElseThrow(() -> ReviewWorkflowException.notFound("Business not found: " + businessId));

        business.setGoogleAccessToken(fieldCipher.encrypt(accessToken));
        if (refreshToken != null && !refreshToken.isBlank()) {
            business.setGoogleRefreshToken(fieldCipher.encrypt(refreshToken));
        }
        business.setUpdatedAt(OffsetDateTime.now(clock));
        businessRepository.save(business);

        log.debug("Stored encrypted OAuth tokens for business {}", businessId);
    }

    /**
     * Internal read of all six decrypted values, for the reply publisher. No ownership check:
     * callers have already authorized the operation that needs the credentials.
     */
    public PublishingCredentials loadForPublishing(Long businessId) {
        Business business = businessRepository.findById(businessId)
                .orElseThrow(() -> ReviewWorkflowException.notFound("Business not found: " + businessId));

        FieldCipher.DecryptedFields decrypted = fieldCipher.decryptFields(storedValues(business), ALL_FIELDS);
        if (decrypted.usedPlaintextFallback()) {
            log.warn("Business {} has unencrypted Google fields {}", businessId, decrypted.plaintextFields());
        }

        return new PublishingCredentials(
                decrypted.get(CLIENT_ID),
                decrypted.get(CLIENT_SECRET),
                decrypted.get(ACCOUNT_ID),
                decrypted.get(LOCATION_ID),
                decrypted.get(ACCESS_TOKEN),
                decrypted.get(REFRESH_TOKEN));
    }

    private Business findOwned(Long businessId, Long requesterUserId) {
        Business business = businessRepository.findById(businessId)
                .orElseThrow(ReviewWorkflowException::notFoundOrForbidden);
        if (ownershipGuard.check(business.getUserId(), requesterUserId) == OwnershipGuard.Decision.FORBIDDEN) {
            log.debug("User {} denied access to credentials of business {}", requesterUserId, businessId);
            throw ReviewWorkflowException.notFoundOrForbidden();
        }
        return business;
    }

    private static Map<String, String> storedValues(Business business) {
        Map<String, String> values = new HashMap<>();
        values.put(CLIENT_ID, business.getGoogleClientId());
        values.put(CLIENT_SECRET, business.getGoogleClientSecret());
        values.put(ACCOUNT_ID, business.getGoogleAccountId());
        values.put(LOCATION_ID, business.getGoogleLocationId());
        values.put(ACCESS_TOKEN, business.getGoogleAccessToken());
        values.put(REFRESH_TOKEN, business.getGoogleRefreshToken());
        return values;
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Owner view of the stored connection. {@code decryptionFailed} is set when at least one
     * field could not be decrypted; those fields are null in {@code credentials}.
     */
    public record CredentialsView(boolean hasCredentials, boolean hasTokens, boolean decryptionFailed,
                                  List<String> unreadableFields, GoogleCredentialsDto credentials) {

        static CredentialsView empty(boolean hasTokens) {
            return new CredentialsView(false, hasTokens, false, List.of(), null);
        }
    }

    /**
     * Decrypted values needed to call Google on a business's behalf.
     */
    public record PublishingCredentials(String clientId, String clientSecret, String accountId, String locationId,
                                        String accessToken, String refreshToken) {

        public boolean isConnected() {
            return present(accountId) && present(locationId) && present(accessToken);
        }

        public boolean canRefresh() {
            return present(clientId) && present(clientSecret) && present(refreshToken);
        }

        private static boolean present(String value) {
            return value != null && !value.isBlank();
        }
    }
}
