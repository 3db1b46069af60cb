package com.replifast.backend.services;

import com.replifast.backend.exceptions.ReviewWorkflowException;
import com.replifast.backend.models.Business;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Single authorization check for every business-scoped operation.
 */
@Component
public class OwnershipGuard {

    public enum Decision {
        AUTHORIZED,
        FORBIDDEN
    }

    public Decision check(Long resourceOwnerId, Long requesterId) {
        if (resourceOwnerId == null || requesterId == null) {
            return Decision.FORBIDDEN;
        }
        return Objects.equals(resourceOwnerId, requesterId) ? Decision.AUTHORIZED : Decision.FORBIDDEN;
    }

    /**
     * Throws FORBIDDEN unless the requester owns the business.
     */
    public void requireOwner(Business business, Long requesterId) {
        if (check(business.getUserId(), requesterId) == Decision.FORBIDDEN) {
            throw ReviewWorkflowException.forbidden("You do not have access to this review");
        }
    }
}
