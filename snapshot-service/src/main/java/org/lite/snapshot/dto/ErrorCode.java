package org.lite.snapshot.dto;

import lombok.Getter;

/**
 * Error codes returned to callers in {@link ErrorResponse}
 */
@Getter
public enum ErrorCode {
    CONFIGURATION_ERROR("Service is not configured correctly"),
    VALIDATION_ERROR("Request is invalid"),
    NOT_FOUND("Snapshot not found"),
    AUTHENTICATION_ERROR("Snapshot could not be read, try again"),
    INTEGRITY_ERROR("Snapshot could not be read, try again"),
    CONFLICT("Concurrent save detected, try again"),
    STORAGE_ERROR("Storage is temporarily unavailable, try again"),
    AUDIT_ERROR("Audit trail is temporarily unavailable, try again"),
    CACHE_ERROR("Cache is temporarily unavailable"),
    PARTIAL_FAILURE("Snapshot was stored but its audit entry is missing"),
    INTERNAL_ERROR("Unexpected error, try again");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }
}
