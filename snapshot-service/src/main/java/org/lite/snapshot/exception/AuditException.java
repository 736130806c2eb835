package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

public class AuditException extends SnapshotVaultException {

    public AuditException(String message, Throwable cause) {
        super(ErrorCode.AUDIT_ERROR, message, cause);
    }
}
