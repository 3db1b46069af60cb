package com.replifast.backend.models;

/**
 * Who approved a reply: the business owner or the auto-approval policy.
 */
public enum ApprovalActor {
    USER,
    SYSTEM
}
