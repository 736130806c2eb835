package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.enums.ApprovalStatus;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotSaveResponse {

    private String snapshotId;
    private Integer version;
    private String tenantId;
    private Integer keyVersion;
    private Instant savedAt;
    private String requestId;
    private ApprovalStatus approvalStatus;
}
