package com.replifast.backend.dto;

import com.replifast.backend.models.ApprovalMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoApproveRequest {

    @NotNull(message = "Business ID is required")
    private Long businessId;

    @NotNull(message = "User ID is required")
    private Long userId;

    /**
     * Explicit reviews to approve; when empty every eligible drafted review is considered.
     */
    @Size(max = 500, message = "At most 500 review IDs per request")
    private List<Long> reviewIds;

    // Overrides the business approval mode for this request only
    private ApprovalMode approvalMode;

    private boolean previewOnly;
}
