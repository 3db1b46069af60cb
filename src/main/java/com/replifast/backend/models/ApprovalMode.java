package com.replifast.backend.models;

/**
 * Per-business policy deciding which drafted reviews the system may approve on its own.
 */
public enum ApprovalMode {
    MANUAL(Integer.MAX_VALUE, "manual approval only"),
    AUTO_4_PLUS(4, "4+ star policy"),
    AUTO_EXCEPT_LOW(3, "except low ratings policy");

    private final int minimumRating;
    private final String description;

    ApprovalMode(int minimumRating, String description) {
        this.minimumRating = minimumRating;
        this.description = description;
    }

    public boolean qualifies(int rating) {
        return this != MANUAL && rating >= minimumRating;
    }

    public String getDescription() {
        return description;
    }
}
