package org.lite.snapshot.exception;

import lombok.Getter;
import org.lite.snapshot.dto.ErrorCode;

/**
 * The snapshot is durable but its audit entry could not be written.
 * Operators reconcile using the tenant and version carried here.
 */
@Getter
public class PartialFailureException extends SnapshotVaultException {

    private final String tenantId;
    private final int version;
    private final String snapshotId;

    public PartialFailureException(String tenantId, int version, String snapshotId, Throwable cause) {
        super(ErrorCode.PARTIAL_FAILURE, String.format(
                "Snapshot version %d for tenant %s (id %s) was stored without an audit entry",
                version, tenantId, snapshotId), cause);
        this.tenantId = tenantId;
        this.version = version;
        this.snapshotId = snapshotId;
    }
}
