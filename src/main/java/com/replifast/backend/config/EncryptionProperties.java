package com.replifast.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Key material for credential encryption.
 *
 * key          - 64 hex characters (raw 256-bit key) or any passphrase, hashed with SHA-256
 * keyVersion   - tag written in front of every new ciphertext
 * retiredKeys  - older keys by version tag, only used to decrypt existing values
 */
@Configuration
@ConfigurationProperties(prefix = "app.encryption")
@Data
public class EncryptionProperties {

    private String key;

    private String keyVersion = "v1";

    private Map<String, String> retiredKeys = new HashMap<>();
}
