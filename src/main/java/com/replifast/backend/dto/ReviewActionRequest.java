package com.replifast.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of draft and approve calls. text is the draft to record or the final reply to approve.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewActionRequest {

    @NotNull(message = "User ID is required")
    private Long userId;

    private String text;
}
