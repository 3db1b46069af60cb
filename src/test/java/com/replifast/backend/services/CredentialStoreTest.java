package com.replifast.backend.services;

import com.replifast.backend.config.EncryptionProperties;
import com.replifast.backend.dto.GoogleCredentialsDto;
import com.replifast.backend.exceptions.ErrorKind;
import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Activity;
import com.replifast.backend.models.Business;
import com.replifast.backend.repositories.BusinessRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialStoreTest {

    private static final Long BUSINESS_ID = 5L;
    private static final Long OWNER_ID = 100L;
    private static final Long OTHER_USER_ID = 200L;

    @Mock
    private BusinessRepository businessRepository;

    @Mock
    private ActivityService activityService;

    private FieldCipher fieldCipher;
    private CredentialStore credentialStore;

    @BeforeEach
    void setUp() {
        EncryptionProperties properties = new EncryptionProperties();
        properties.setKey("unit-test-passphrase");
        fieldCipher = new FieldCipher(properties);

        Clock clock = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
        credentialStore = new CredentialStore(businessRepository, fieldCipher, new OwnershipGuard(),
                activityService, clock);
    }

    @Test
    void getCredentials_NotOwner_ShouldLookLikeNotFound() {
        // Given
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(connectedBusiness()));
        when(businessRepository.findById(99L)).thenReturn(Optional.empty());

        // When
        Throwable notOwner = catchThrowable(() -> credentialStore.getCredentials(BUSINESS_ID, OTHER_USER_ID));
        Throwable missing = catchThrowable(() -> credentialStore.getCredentials(99L, OTHER_USER_ID));

        // Then
        assertThat(notOwner).isInstanceOf(ReviewWorkflowException.class);
        assertThat(((ReviewWorkflowException) notOwner).getKind()).isEqualTo(ErrorKind.NOT_FOUND_OR_FORBIDDEN);
        assertThat(notOwner.getMessage()).isEqualTo(missing.getMessage());
        assertThat(((ReviewWorkflowException) missing).getKind()).isEqualTo(ErrorKind.NOT_FOUND_OR_FORBIDDEN);
    }

    @Test
    void getCredentials_Owner_ShouldReturnDecryptedBundle() {
        // Given
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(connectedBusiness()));

        // When
        CredentialStore.CredentialsView view = credentialStore.getCredentials(BUSINESS_ID, OWNER_ID);

        // Then
        assertThat(view.hasCredentials()).isTrue();
        assertThat(view.hasTokens()).isTrue();
        assertThat(view.credentials().getClientId()).isEqualTo("client-id");
        assertThat(view.credentials().getClientSecret()).isEqualTo("client-secret");
        assertThat(view.credentials().getLocationId()).isEqualTo("locations/42");
        assertThat(view.decryptionFailed()).isFalse();
        assertThat(view.unreadableFields()).isEmpty();
    }

    @Test
    void getCredentials_LegacyPlaintext_ShouldFallBackInsteadOfFailing() {
        // Given
        Business business = connectedBusiness();
        business.setGoogleClientSecret("plaintext-secret");
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(business));

        // When
        CredentialStore.CredentialsView view = credentialStore.getCredentials(BUSINESS_ID, OWNER_ID);

        // Then
        assertThat(view.credentials().getClientSecret()).isEqualTo("plaintext-secret");
        assertThat(view.credentials().getClientId()).isEqualTo("client-id");
    }

    @Test
    void getCredentials_WrittenUnderRotatedKey_ShouldDegradeInsteadOfFailing() {
        // Given
        EncryptionProperties oldProperties = new EncryptionProperties();
        oldProperties.setKey("old-deployment-key");
        FieldCipher oldCipher = new FieldCipher(oldProperties);

        EncryptionProperties newProperties = new EncryptionProperties();
        newProperties.setKey("new-deployment-key");
        CredentialStore rotatedStore = new CredentialStore(businessRepository, new FieldCipher(newProperties),
                new OwnershipGuard(), activityService, Clock.systemUTC());

        Business business = Business.builder()
                .id(BUSINESS_ID)
                .userId(OWNER_ID)
                .googleClientId(oldCipher.encrypt("client-id"))
                .googleClientSecret(oldCipher.encrypt("client-secret"))
                .googleAccountId("accounts/1")
                .googleLocationId(oldCipher.encrypt("locations/42"))
                .build();
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(business));

        // When
        CredentialStore.CredentialsView view = rotatedStore.getCredentials(BUSINESS_ID, OWNER_ID);

        // Then
        assertThat(view.hasCredentials()).isTrue();
        assertThat(view.decryptionFailed()).isTrue();
        assertThat(view.unreadableFields()).containsExactly("clientId", "clientSecret", "locationId");
        assertThat(view.credentials().getClientId()).isNull();
        assertThat(view.credentials().getClientSecret()).isNull();
        assertThat(view.credentials().getAccountId()).isEqualTo("accounts/1");
    }

    @Test
    void getCredentials_NothingStored_ShouldReportFlagsOnly() {
        // Given
        Business empty = Business.builder().id(BUSINESS_ID).userId(OWNER_ID).build();
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(empty));

        // When
        CredentialStore.CredentialsView view = credentialStore.getCredentials(BUSINESS_ID, OWNER_ID);

        // Then
        assertThat(view.hasCredentials()).isFalse();
        assertThat(view.hasTokens()).isFalse();
        assertThat(view.decryptionFailed()).isFalse();
        assertThat(view.credentials()).isNull();
    }

    @Test
    void saveCredentials_Partial_ShouldRejectWithoutWriting() {
        // Given
        GoogleCredentialsDto partial = GoogleCredentialsDto.builder()
                .clientId("client-id")
                .clientSecret("  ")
                .accountId("accounts/1")
                .build();

        // When / Then
        assertThatThrownBy(() -> credentialStore.saveCredentials(BUSINESS_ID, OWNER_ID, partial))
                .isInstanceOf(ReviewWorkflowException.class)
                .hasMessageContaining("clientSecret")
                .hasMessageContaining("locationId");
        verifyNoInteractions(businessRepository, activityService);
    }

    @Test
    void saveCredentials_ShouldStoreCiphertextScopedToOwner() {
        // Given
        when(businessRepository.updateCredentialBundle(eq(BUSINESS_ID), eq(OWNER_ID), anyString(), anyString(),
                anyString(), anyString(), any(OffsetDateTime.class))).thenReturn(1);

        // When
        credentialStore.saveCredentials(BUSINESS_ID, OWNER_ID, completeBundle());

        // Then
        ArgumentCaptor<String> secret = ArgumentCaptor.forClass(String.class);
        verify(businessRepository).updateCredentialBundle(eq(BUSINESS_ID), eq(OWNER_ID), anyString(), secret.capture(),
                anyString(), anyString(), eq(OffsetDateTime.parse("2026-03-15T10:00:00Z")));
        assertThat(secret.getValue()).startsWith("v1:").doesNotContain("client-secret");
        assertThat(fieldCipher.decrypt(secret.getValue()).value()).isEqualTo("client-secret");
        verify(activityService).record(eq(BUSINESS_ID), eq(Activity.ActivityType.CREDENTIALS_SAVED), anyString(), anyMap());
    }

    @Test
    void saveCredentials_NotOwner_ShouldReturnNotFoundOrForbidden() {
        // Given
        when(businessRepository.updateCredentialBundle(any(), any(), any(), any(), any(), any(), any())).thenReturn(0);

        // When / Then
        assertThatThrownBy(() -> credentialStore.saveCredentials(BUSINESS_ID, OTHER_USER_ID, completeBundle()))
                .isInstanceOf(ReviewWorkflowException.class)
                .extracting(e -> ((ReviewWorkflowException) e).getKind())
                .isEqualTo(ErrorKind.NOT_FOUND_OR_FORBIDDEN);
        verifyNoInteractions(activityService);
    }

    @Test
    void disconnect_ShouldClearEverythingForOwner() {
        // Given
        when(businessRepository.clearGoogleConnection(eq(BUSINESS_ID), eq(OWNER_ID), any())).thenReturn(1);

        // When
        credentialStore.disconnect(BUSINESS_ID, OWNER_ID);

        // Then
        verify(businessRepository).clearGoogleConnection(eq(BUSINESS_ID), eq(OWNER_ID), any());
        verify(activityService).record(eq(BUSINESS_ID), eq(Activity.ActivityType.CREDENTIALS_REMOVED), anyString(), anyMap());
    }

    @Test
    void saveTokens_NullRefreshToken_ShouldKeepStoredOne() {
        // Given
        Business business = connectedBusiness();
        String storedRefresh = business.getGoogleRefreshToken();
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(business));

        // When
        credentialStore.saveTokens(BUSINESS_ID, "new-access-token", null);

        // Then
        verify(businessRepository).save(business);
        assertThat(business.getGoogleRefreshToken()).isEqualTo(storedRefresh);
        assertThat(fieldCipher.decrypt(business.getGoogleAccessToken()).value()).isEqualTo("new-access-token");
    }

    @Test
    void loadForPublishing_ShouldDecryptAllSixFields() {
        // Given
        when(businessRepository.findById(BUSINESS_ID)).thenReturn(Optional.of(connectedBusiness()));

        // When
        CredentialStore.PublishingCredentials credentials = credentialStore.loadForPublishing(BUSINESS_ID);

        // Then
        assertThat(credentials.accountId()).isEqualTo("accounts/1");
        assertThat(credentials.accessToken()).isEqualTo("access-token");
        assertThat(credentials.refreshToken()).isEqualTo("refresh-token");
        assertThat(credentials.isConnected()).isTrue();
        assertThat(credentials.canRefresh()).isTrue();
    }

    @Test
    void writes_ShouldRunInDeclarativeTransactions() throws Exception {
        assertThat(CredentialStore.class.getMethod("saveCredentials", Long.class, Long.class, GoogleCredentialsDto.class)
                .isAnnotationPresent(Transactional.class)).isTrue();
        assertThat(CredentialStore.class.getMethod("disconnect", Long.class, Long.class)
                .isAnnotationPresent(Transactional.class)).isTrue();
        assertThat(CredentialStore.class.getMethod("saveTokens", Long.class, String.class, String.class)
                .isAnnotationPresent(Transactional.class)).isTrue();
        assertThat(CredentialStore.class.getMethod("getCredentials", Long.class, Long.class)
                .getAnnotation(Transactional.class).readOnly()).isTrue();
    }

    private Business connectedBusiness() {
        return Business.builder()
                .id(BUSINESS_ID)
                .userId(OWNER_ID)
                .name("Bob's Roofing")
                .googleClientId(fieldCipher.encrypt("client-id"))
                .googleClientSecret(fieldCipher.encrypt("client-secret"))
                .googleAccountId(fieldCipher.encrypt("accounts/1"))
                .googleLocationId(fieldCipher.encrypt("locations/42"))
                .googleAccessToken(fieldCipher.encrypt("access-token"))
                .googleRefreshToken(fieldCipher.encrypt("refresh-token"))
                .build();
    }

    private static GoogleCredentialsDto completeBundle() {
        return GoogleCredentialsDto.builder()
                .clientId("client-id")
                .clientSecret("client-secret")
                .accountId("accounts/1")
                .locationId("locations/42")
                .build();
    }
}
