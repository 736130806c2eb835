package org.lite.snapshot.exception;

import lombok.Getter;
import org.lite.snapshot.dto.ErrorCode;

/**
 * Base class of every error raised by the snapshot subsystem
 */
@Getter
public abstract class SnapshotVaultException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SnapshotVaultException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SnapshotVaultException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
