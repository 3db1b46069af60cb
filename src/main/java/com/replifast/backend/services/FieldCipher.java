package com.replifast.backend.services;

import com.replifast.backend.config.EncryptionProperties;
import com.replifast.backend.exceptions.CredentialDecryptionException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.*;
import java.util.regex.Pattern;

/**
 * AES-256-GCM encryption of individual record fields.
 *
 * Stored format is {@code <version>:<base64 iv>:<base64 ciphertext+tag>}, e.g. {@code v1:...:...}.
 * Values written before versioning use hex {@code iv:tag:ciphertext} and are still readable.
 * Anything else is treated as legacy plaintext and reported as such.
 */
@Component
@Slf4j
public class FieldCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int IV_LENGTH = 12; // bytes (96 bits)

    private static final Pattern VERSION_TAG = Pattern.compile("v\\d+");
    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    private final String currentVersion;
    private final SecretKeySpec currentKey;
    private final Map<String, SecretKeySpec> keysByVersion = new LinkedHashMap<>();
    private final SecureRandom secureRandom = new SecureRandom();

    public FieldCipher(EncryptionProperties properties) {
        if (properties.getKey() == null || properties.getKey().isBlank()) {
            throw new IllegalStateException(
                    "CREDENTIALS_ENCRYPTION_KEY is not set. Cannot start without a key for credential storage.");
        }
        if (properties.getKeyVersion() == null || !VERSION_TAG.matcher(properties.getKeyVersion()).matches()) {
            throw new IllegalStateException("app.encryption.key-version must look like v1, v2, ...: "
                    + properties.getKeyVersion());
        }

        this.currentVersion = properties.getKeyVersion();
        this.currentKey = deriveKey(properties.getKey());
        keysByVersion.put(currentVersion, currentKey);

        properties.getRetiredKeys().forEach((version, material) -> {
            if (!VERSION_TAG.matcher(version).matches() || version.equals(currentVersion)) {
                throw new IllegalStateException("Invalid retired key version: " + version);
            }
            keysByVersion.put(version, deriveKey(material));
        });
    }

    @PostConstruct
    void selfCheck() {
        String sample = "field-cipher-check-" + System.nanoTime();
        DecryptionResult result = decrypt(encrypt(sample));
        if (!result.isDecrypted() || !sample.equals(result.value())) {
            throw new IllegalStateException("Credential encryption self-check failed");
        }
        log.info("Field cipher ready (current key {}, {} key version(s) loaded)", currentVersion, keysByVersion.size());
    }

    /**
     * Encrypt a single value with a fresh IV. Null and empty values are returned unchanged.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return plaintext;
        }
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, currentKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder encoder = Base64.getEncoder();
            return currentVersion + ":" + encoder.encodeToString(iv) + ":" + encoder.encodeToString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    /**
     * Decrypt a stored value. Values that carry no ciphertext format come back as
     * {@link DecryptionResult.Kind#PLAINTEXT_FALLBACK}; values that do but fail to decrypt throw.
     */
    public DecryptionResult decrypt(String stored) {
        return decryptValue(stored, "value");
    }

    public Map<String, String> encryptFields(Map<String, String> record, Collection<String> fieldNames) {
        Map<String, String> result = new LinkedHashMap<>(record);
        for (String field : fieldNames) {
            String value = result.get(field);
            if (value != null && !value.isEmpty()) {
                result.put(field, encrypt(value));
            }
        }
        return result;
    }

    public DecryptedFields decryptFields(Map<String, String> record, Collection<String> fieldNames) {
        Map<String, String> result = new LinkedHashMap<>(record);
        Set<String> plaintextFields = new LinkedHashSet<>();
        for (String field : fieldNames) {
            String value = result.get(field);
            if (value == null || value.isEmpty()) {
                continue;
            }
            DecryptionResult decrypted = decryptValue(value, field);
            if (!decrypted.isDecrypted()) {
                plaintextFields.add(field);
            }
            result.put(field, decrypted.value());
        }
        return new DecryptedFields(result, plaintextFields);
    }

    /**
     * New random 256-bit key as 64 hex characters, suitable for CREDENTIALS_ENCRYPTION_KEY.
     */
    public static String generateKey() {
        byte[] key = new byte[32];
        new SecureRandom().nextBytes(key);
        return HexFormat.of().formatHex(key);
    }

    private DecryptionResult decryptValue(String stored, String label) {
        if (stored == null || stored.isEmpty()) {
            return DecryptionResult.decrypted(stored);
        }

        String[] parts = stored.split(":", -1);
        if (parts.length == 3 && VERSION_TAG.matcher(parts[0]).matches()) {
            return DecryptionResult.decrypted(decryptVersioned(parts));
        }
        if (parts.length == 3 && isLegacyHexFormat(parts)) {
            return DecryptionResult.decrypted(decryptLegacy(parts));
        }

        log.warn("Stored {} is not encrypted, using plaintext compatibility path", label);
        return DecryptionResult.plaintextFallback(stored);
    }

    private String decryptVersioned(String[] parts) {
        SecretKeySpec key = keysByVersion.get(parts[0]);
        if (key == null) {
            throw new CredentialDecryptionException("No key registered for ciphertext version " + parts[0]);
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            return new String(doDecrypt(key, decoder.decode(parts[1]), decoder.decode(parts[2])), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialDecryptionException("Failed to decrypt " + parts[0] + " ciphertext", e);
        }
    }

    private String decryptLegacy(String[] parts) {
        HexFormat hex = HexFormat.of();
        byte[] iv = hex.parseHex(parts[0]);
        byte[] tag = hex.parseHex(parts[1]);
        byte[] body = hex.parseHex(parts[2]);

        // JCE expects the tag appended to the ciphertext
        byte[] combined = new byte[body.length + tag.length];
        System.arraycopy(body, 0, combined, 0, body.length);
        System.arraycopy(tag, 0, combined, body.length, tag.length);

        GeneralSecurityException last = null;
        for (SecretKeySpec key : keysByVersion.values()) {
            try {
                return new String(doDecrypt(key, iv, combined), StandardCharsets.UTF_8);
            } catch (GeneralSecurityException e) {
                last = e;
            }
        }
        throw new CredentialDecryptionException("Failed to decrypt legacy ciphertext", last);
    }

    private byte[] doDecrypt(SecretKeySpec key, byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
        return cipher.doFinal(ciphertext);
    }

    private static boolean isLegacyHexFormat(String[] parts) {
        return parts[0].length() == IV_LENGTH * 2
                && parts[1].length() == GCM_TAG_LENGTH / 4
                && !parts[2].isEmpty()
                && parts[2].length() % 2 == 0
                && HEX.matcher(parts[0]).matches()
                && HEX.matcher(parts[1]).matches()
                && HEX.matcher(parts[2]).matches();
    }

    static SecretKeySpec deriveKey(String material) {
        byte[] keyBytes;
        if (material.length() == 64 && HEX.matcher(material).matches()) {
            keyBytes = HexFormat.of().parseHex(material);
        } else {
            try {
                keyBytes = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 not available", e);
            }
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    /**
     * Outcome of decrypting one stored value.
     */
    public record DecryptionResult(Kind kind, String value) {

        public enum Kind {
            DECRYPTED,
            PLAINTEXT_FALLBACK
        }

        static DecryptionResult decrypted(String value) {
            return new DecryptionResult(Kind.DECRYPTED, value);
        }

        static DecryptionResult plaintextFallback(String value) {
            return new DecryptionResult(Kind.PLAINTEXT_FALLBACK, value);
        }

        public boolean isDecrypted() {
            return kind == Kind.DECRYPTED;
        }
    }

    /**
     * Record with the requested fields decrypted, plus the fields that were stored as plaintext.
     */
    public record DecryptedFields(Map<String, String> values, Set<String> plaintextFields) {

        public String get(String field) {
            return values.get(field);
        }

        public boolean usedPlaintextFallback() {
            return !plaintextFields.isEmpty();
        }
    }
}
