package com.replifast.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Google OAuth client and location identifiers of a business. Completeness is checked by
 * the credential store so a partial bundle is rejected as a whole.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "clientSecret")
public class GoogleCredentialsDto {
    private String clientId;
    private String clientSecret;
    private String accountId;
    private String locationId;
}
