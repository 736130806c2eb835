package org.lite.snapshot.enums;

public enum AuditResult {
    SUCCESS,
    FAILED
}
