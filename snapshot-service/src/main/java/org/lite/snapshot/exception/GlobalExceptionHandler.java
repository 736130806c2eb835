package org.lite.snapshot.exception;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.ErrorCode;
import org.lite.snapshot.dto.ErrorResponse;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps snapshot errors to HTTP responses with a consistent {@link ErrorResponse} body
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String UNREADABLE_SNAPSHOT = "Snapshot could not be read, try again";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SnapshotNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), null);
    }

    /**
     * Tag and checksum failures share one generic message; the cause is only logged
     */
    @ExceptionHandler({EnvelopeAuthenticationException.class, IntegrityException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(SnapshotVaultException ex) {
        log.error("Snapshot failed verification: {}", ex.getClass().getSimpleName());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), UNREADABLE_SNAPSHOT, null);
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(VersionConflictException ex) {
        log.warn("Version conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler({StorageException.class, AuditException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(SnapshotVaultException ex) {
        log.error("Backend unavailable: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(PartialFailureException.class)
    public ResponseEntity<ErrorResponse> handlePartialFailure(PartialFailureException ex) {
        log.error("Partial failure: {}", ex.getMessage(), ex);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tenantId", ex.getTenantId());
        details.put("version", ex.getVersion());
        details.put("snapshotId", ex.getSnapshotId());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), details);
    }

    @ExceptionHandler(SnapshotVaultException.class)
    public ResponseEntity<ErrorResponse> handleSnapshotVault(SnapshotVaultException ex) {
        log.error("Unhandled snapshot error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getErrorCode().getDefaultMessage(), null);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBind(WebExchangeBindException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getFieldErrors().forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Request validation failed", details);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, ex.getReason(), null);
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(DataBufferLimitException ex) {
        log.warn("Rejected oversized request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Request body is too large", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, null, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorCode code, String message,
                                                  Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.fromErrorCode(code, message, status.value());
        body.setDetails(details);
        return ResponseEntity.status(status).body(body);
    }
}
