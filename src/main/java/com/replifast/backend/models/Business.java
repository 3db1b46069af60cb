package com.replifast.backend.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * A tenant's connected Google Business Profile location.
 *
 * The six google_* columns hold ciphertext produced by the field cipher. Older rows may still
 * carry plaintext; readers go through the credential store, never these getters directly.
 */
@Entity
@Table(name = "businesses")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"googleClientId", "googleClientSecret", "googleAccessToken", "googleRefreshToken"})
public class Business {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    private String industry;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "plan_id")
    @Builder.Default
    private String planId = "basic";

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_mode")
    @Builder.Default
    private ApprovalMode approvalMode = ApprovalMode.MANUAL;

    @Column(name = "brand_voice_preset")
    @Builder.Default
    private String brandVoicePreset = "professional";

    @Column(name = "brand_voice_instruction", columnDefinition = "TEXT")
    private String brandVoiceInstruction;

    // Provider credential bundle
    @Column(name = "google_client_id", columnDefinition = "TEXT")
    private String googleClientId;

    @Column(name = "google_client_secret", columnDefinition = "TEXT")
    private String googleClientSecret;

    @Column(name = "google_account_id", columnDefinition = "TEXT")
    private String googleAccountId;

    @Column(name = "google_location_id", columnDefinition = "TEXT")
    private String googleLocationId;

    // OAuth tokens
    @Column(name = "google_access_token", columnDefinition = "TEXT")
    private String googleAccessToken;

    @Column(name = "google_refresh_token", columnDefinition = "TEXT")
    private String googleRefreshToken;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        updatedAt = createdAt;
    }

    public boolean hasCredentialBundle() {
        return isSet(googleClientId) && isSet(googleClientSecret)
                && isSet(googleAccountId) && isSet(googleLocationId);
    }

    public boolean hasTokens() {
        return isSet(googleAccessToken) && isSet(googleRefreshToken);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
