package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;

import java.time.Instant;
import java.util.List;

/**
 * Filters for audit queries. Only tenantId is required; the time range defaults to the last 90 days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogQueryRequest {

    private String tenantId;

    private Instant startTime;

    private Instant endTime;

    private List<AuditAction> actions;

    private String actorId;

    private AuditResult result;

    private Integer snapshotVersion;

    /**
     * Page number (0-indexed)
     */
    @Builder.Default
    private Integer page = 0;

    @Builder.Default
    private Integer size = 50;
}
