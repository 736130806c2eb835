package org.lite.snapshot.enums;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
