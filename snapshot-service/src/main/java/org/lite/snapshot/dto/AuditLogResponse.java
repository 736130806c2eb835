package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogResponse {

    private String eventId;
    private String tenantId;
    private String snapshotId;
    private Integer snapshotVersion;
    private AuditAction action;
    private AuditResult result;
    private String actorId;
    private String summary;
    private String requestId;
    private Map<String, Object> details;
    private Instant timestamp;

    public static AuditLogResponse fromEntity(SnapshotAuditLog entry) {
        return AuditLogResponse.builder()
                .eventId(entry.getEventId())
                .tenantId(entry.getTenantId())
                .snapshotId(entry.getSnapshotId())
                .snapshotVersion(entry.getSnapshotVersion())
                .action(entry.getAction())
                .result(entry.getResult())
                .actorId(entry.getActorId())
                .summary(entry.getSummary())
                .requestId(entry.getRequestId())
                .details(entry.getDetails())
                .timestamp(entry.getTimestamp())
                .build();
    }
}
