package org.lite.snapshot.service;

import org.lite.snapshot.dto.AuditLogPageResponse;
import org.lite.snapshot.dto.AuditLogQueryRequest;
import org.lite.snapshot.dto.AuditTrailEntry;
import org.lite.snapshot.entity.SnapshotAuditLog;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Append-only audit trail for snapshot actions
 */
public interface AuditService {

    /**
     * Persists the entry. Missing eventId and timestamp are filled in and the
     * partition key is always derived from the timestamp.
     *
     * @return the eventId of the stored entry
     * @throws org.lite.snapshot.exception.AuditException (signalled) when the entry could not be stored
     */
    Mono<String> record(SnapshotAuditLog entry);

    /**
     * Matching entries, newest first; ties on timestamp are broken by snapshot version descending
     */
    Flux<SnapshotAuditLog> query(AuditLogQueryRequest request);

    Mono<AuditLogPageResponse> queryPage(AuditLogQueryRequest request);

    /**
     * Tenant trail for the window, newest first. Null bounds default to the configured query window.
     */
    Flux<AuditTrailEntry> getAuditTrail(String tenantId, Instant from, Instant to);

    /**
     * Newest successful APPROVE or REJECT entry for the version, empty when none exists.
     * Entries sharing a timestamp resolve to the one stored last.
     */
    Mono<SnapshotAuditLog> findLatestDecision(String tenantId, int snapshotVersion);
}
