package com.replifast.backend.models;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reply lifecycle of a review: PENDING -> DRAFTED -> APPROVED -> POSTED.
 * POSTED is terminal; a failed publish leaves the review APPROVED.
 */
public enum ReviewStatus {
    PENDING,
    DRAFTED,
    APPROVED,
    POSTED;

    public Set<ReviewStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(DRAFTED);
            case DRAFTED:
                return EnumSet.of(APPROVED);
            case APPROVED:
                return EnumSet.of(POSTED);
            default:
                return EnumSet.noneOf(ReviewStatus.class);
        }
    }

    public boolean canTransitionTo(ReviewStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == POSTED;
    }
}
