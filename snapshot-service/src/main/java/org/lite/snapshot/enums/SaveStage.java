package org.lite.snapshot.enums;

/**
 * Stages of a snapshot save, executed strictly in declaration order
 */
public enum SaveStage {
    VALIDATING,
    DERIVING,
    ENCRYPTING,
    APPENDING,
    AUDITING,
    INVALIDATING,
    DONE
}
