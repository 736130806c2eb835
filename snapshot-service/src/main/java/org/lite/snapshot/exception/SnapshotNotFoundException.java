package org.lite.snapshot.exception;

import lombok.Getter;
import org.lite.snapshot.dto.ErrorCode;

@Getter
public class SnapshotNotFoundException extends SnapshotVaultException {

    private final String tenantId;
    private final Integer version;

    public SnapshotNotFoundException(String tenantId) {
        super(ErrorCode.NOT_FOUND, String.format("No snapshot exists for tenant %s", tenantId));
        this.tenantId = tenantId;
        this.version = null;
    }

    public SnapshotNotFoundException(String tenantId, int version) {
        super(ErrorCode.NOT_FOUND, String.format("Snapshot version %d not found for tenant %s", version, tenantId));
        this.tenantId = tenantId;
        this.version = version;
    }
}
