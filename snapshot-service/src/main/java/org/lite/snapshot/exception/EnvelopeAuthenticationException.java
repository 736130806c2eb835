package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

/**
 * AEAD tag did not verify: tampered or corrupted ciphertext, or a wrong key.
 * Never carries any part of the plaintext.
 */
public class EnvelopeAuthenticationException extends SnapshotVaultException {

    public EnvelopeAuthenticationException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_ERROR, message, cause);
    }
}
