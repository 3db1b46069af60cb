package com.replifast.backend.exceptions;

/**
 * A value carried a ciphertext format but could not be decrypted (wrong key, unknown key
 * version or tampered data). Distinct from legacy plaintext, which is not an error.
 */
public class CredentialDecryptionException extends RuntimeException {

    public CredentialDecryptionException(String message) {
        super(message);
    }

    public CredentialDecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
