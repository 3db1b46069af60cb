package com.replifast.backend.repositories;

import com.replifast.backend.models.Review;
import com.replifast.backend.models.ReviewStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {

    // ================================================================
    // LOOKUPS
    // ================================================================

    /**
     * Review joined with its owning business
     */
    @Query("SELECT r FROM Review r JOIN FETCH r.business WHERE r.id = :id")
    Optional<Review> findWithBusinessById(@Param("id") Long id);

    /**
     * Locks the review row (only that row) until the surrounding transaction ends.
     * Serializes publish attempts for one review.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Review r WHERE r.id = :id")
    Optional<Review> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT r FROM Review r WHERE r.business.id = :businessId AND r.status = :status ORDER BY r.createdAt ASC")
    List<Review> findByBusinessIdAndStatus(@Param("businessId") Long businessId,
                                           @Param("status") ReviewStatus status);

    /**
     * Reviews of a business created since the given instant (approval statistics)
     */
    @Query("SELECT r FROM Review r WHERE r.business.id = :businessId AND r.createdAt >= :since")
    List<Review> findByBusinessIdCreatedSince(@Param("businessId") Long businessId,
                                              @Param("since") OffsetDateTime since);

    /**
     * Replies posted for a business since the given instant (monthly plan quota)
     */
    @Query("SELECT COUNT(r) FROM Review r WHERE r.business.id = :businessId " +
            "AND r.status = com.replifast.backend.models.ReviewStatus.POSTED AND r.postedAt >= :since")
    long countPostedSince(@Param("businessId") Long businessId, @Param("since") OffsetDateTime since);

    // ================================================================
    // CONDITIONAL TRANSITIONS - each returns the number of rows changed (0 or 1)
    // ================================================================

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Review r SET r.aiReply = :draft, r.status = com.replifast.backend.models.ReviewStatus.DRAFTED, " +
            "r.updatedAt = :now WHERE r.id = :id AND r.status = com.replifast.backend.models.ReviewStatus.PENDING")
    int markDrafted(@Param("id") Long id, @Param("draft") String draft, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Review r SET r.finalReply = :finalReply, r.autoApproved = :autoApproved, " +
            "r.status = com.replifast.backend.models.ReviewStatus.APPROVED, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status = com.replifast.backend.models.ReviewStatus.DRAFTED")
    int markApproved(@Param("id") Long id,
                     @Param("finalReply") String finalReply,
                     @Param("autoApproved") boolean autoApproved,
                     @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Review r SET r.finalReply = :finalReply, r.postedAt = :postedAt, " +
            "r.status = com.replifast.backend.models.ReviewStatus.POSTED, r.updatedAt = :postedAt " +
            "WHERE r.id = :id AND r.status = com.replifast.backend.models.ReviewStatus.APPROVED")
    int markPosted(@Param("id") Long id,
                   @Param("finalReply") String finalReply,
                   @Param("postedAt") OffsetDateTime postedAt);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Review r SET r.finalReply = :finalReply, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status = com.replifast.backend.models.ReviewStatus.POSTED")
    int updatePostedReply(@Param("id") Long id,
                          @Param("finalReply") String finalReply,
                          @Param("now") OffsetDateTime now);
}
