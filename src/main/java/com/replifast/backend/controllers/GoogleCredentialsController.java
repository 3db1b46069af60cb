package com.replifast.backend.controllers;

import com.replifast.backend.dto.GoogleCredentialsDto;
import com.replifast.backend.services.CredentialStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Google Business Profile credential bundle of a business.
 */
@RestController
@RequestMapping("/api/v1/businesses/{businessId}/google-credentials")
@RequiredArgsConstructor
public class GoogleCredentialsController {

    private final CredentialStore credentialStore;

    @GetMapping
    public ResponseEntity<CredentialStore.CredentialsView> get(@PathVariable Long businessId,
                                                               @RequestParam Long userId) {
        return ResponseEntity.ok(credentialStore.getCredentials(businessId, userId));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> save(@PathVariable Long businessId,
                                                    @RequestParam Long userId,
                                                    @RequestBody GoogleCredentialsDto credentials) {
        credentialStore.saveCredentials(businessId, userId, credentials);
        return ResponseEntity.ok(Map.of("success", true, "message", "Credentials saved securely"));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> disconnect(@PathVariable Long businessId,
                                                          @RequestParam Long userId) {
        credentialStore.disconnect(businessId, userId);
        return ResponseEntity.ok(Map.of("success", true, "message", "Google Business Profile disconnected"));
    }
}
