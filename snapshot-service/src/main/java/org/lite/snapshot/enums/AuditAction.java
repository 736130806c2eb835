package org.lite.snapshot.enums;

/**
 * Enumeration of snapshot audit actions
 */
public enum AuditAction {
    SAVE,
    READ,
    ROLLBACK,
    KEY_ROTATE,
    APPROVE,
    REJECT,
    SAVE_FAILED
}
