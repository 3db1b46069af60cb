package com.replifast.backend.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostReplyRequest {

    @NotNull(message = "Review ID is required")
    private Long reviewId;

    @NotNull(message = "User ID is required")
    private Long userId;

    // Optional; defaults to the approved reply
    @Size(max = 4096, message = "Reply must be at most 4096 characters")
    private String replyText;
}
