package com.replifast.backend.repositories;

import com.replifast.backend.models.Business;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface BusinessRepository extends JpaRepository<Business, Long> {

    /**
     * Write the complete credential bundle in one statement, scoped to the owner.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Business b SET b.googleClientId = :clientId, b.googleClientSecret = :clientSecret, " +
            "b.googleAccountId = :accountId, b.googleLocationId = :locationId, b.updatedAt = :updatedAt " +
            "WHERE b.id = :id AND b.userId = :userId")
    int updateCredentialBundle(@Param("id") Long id,
                               @Param("userId") Long userId,
                               @Param("clientId") String clientId,
                               @Param("clientSecret") String clientSecret,
                               @Param("accountId") String accountId,
                               @Param("locationId") String locationId,
                               @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Business b SET b.googleClientId = NULL, b.googleClientSecret = NULL, " +
            "b.googleAccountId = NULL, b.googleLocationId = NULL, " +
            "b.googleAccessToken = NULL, b.googleRefreshToken = NULL, b.updatedAt = :updatedAt " +
            "WHERE b.id = :id AND b.userId = :userId")
    int clearGoogleConnection(@Param("id") Long id,
                              @Param("userId") Long userId,
                              @Param("updatedAt") OffsetDateTime updatedAt);
}
