package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

public class StorageException extends SnapshotVaultException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
