package org.lite.snapshot.exception;

import lombok.Getter;
import org.lite.snapshot.dto.ErrorCode;

/**
 * Version race lost on every attempt of the retry budget. The whole save may be retried.
 */
@Getter
public class VersionConflictException extends SnapshotVaultException {

    private final String tenantId;
    private final int attempts;

    public VersionConflictException(String tenantId, int attempts, Throwable cause) {
        super(ErrorCode.CONFLICT, String.format(
                "Could not assign a snapshot version for tenant %s after %d attempts", tenantId, attempts), cause);
        this.tenantId = tenantId;
        this.attempts = attempts;
    }
}
