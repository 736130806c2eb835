package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.enums.ApprovalStatus;
import org.lite.snapshot.enums.SnapshotSource;

import java.time.Instant;

/**
 * Approval state of one snapshot version, derived from its newest decision in the audit trail
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalStatusResponse {

    private String tenantId;
    private Integer version;
    private SnapshotSource source;
    private ApprovalStatus status;
    private String decidedBy;   // null while no decision exists
    private Instant decidedAt;
    private String comment;
}
