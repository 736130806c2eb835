package org.lite.snapshot.exception;

/**
 * Envelope rejected before decryption because a field has the wrong size or is missing
 */
public class EnvelopeFormatException extends ValidationException {

    public EnvelopeFormatException(String message) {
        super(message);
    }
}
