package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

/**
 * The caller's input is malformed. Recoverable, surfaced to the caller as a form error.
 */
public class ValidationException extends SnapshotVaultException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
