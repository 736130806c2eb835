package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

/**
 * Decrypted plaintext does not match its stored checksum or is not a readable document
 */
public class IntegrityException extends SnapshotVaultException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY_ERROR, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_ERROR, message, cause);
    }
}
