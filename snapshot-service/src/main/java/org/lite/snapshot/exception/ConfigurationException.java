package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

/**
 * Fatal startup-time misconfiguration, e.g. a missing master secret
 */
public class ConfigurationException extends SnapshotVaultException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
