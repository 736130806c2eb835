package org.lite.snapshot.service;

import org.lite.snapshot.dto.ArchivalResult;
import org.lite.snapshot.entity.SnapshotAuditLog;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Moves audit entries past the retention window from the hot collection into
 * monthly archive collections ({@code bia_audit_logs_archive_yyyy_MM}).
 */
public interface AuditArchivalService {

    /**
     * Archive entries older than {@code retentionDays}
     */
    Mono<ArchivalResult> archiveOldLogs(int retentionDays);

    /**
     * Archive entries with a timestamp strictly before the threshold.
     * Entries are copied first and removed from the hot collection only after the copy succeeded.
     */
    Mono<ArchivalResult> archiveLogsBefore(Instant threshold);

    /**
     * Archived entries of one tenant in one partition (yyyy-MM), newest first
     */
    Flux<SnapshotAuditLog> queryArchived(String tenantId, String partitionKey);
}
