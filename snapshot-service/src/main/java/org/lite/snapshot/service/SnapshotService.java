package org.lite.snapshot.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.lite.snapshot.dto.ApprovalStatusResponse;
import org.lite.snapshot.dto.AuditTrailEntry;
import org.lite.snapshot.dto.KeyRotationResponse;
import org.lite.snapshot.dto.ReencryptionResponse;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSaveResponse;
import org.lite.snapshot.enums.SnapshotSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Entry point for everything that reads or changes a tenant's BIA snapshots.
 *
 * A save derives the tenant DEK, encrypts, appends the next version, records a SAVE
 * audit entry and invalidates cached views, in that order. Durable steps are never
 * rolled back: when the audit entry cannot be written after the append succeeded,
 * the save fails with {@link org.lite.snapshot.exception.PartialFailureException}
 * naming the stored version.
 */
public interface SnapshotService {

    /**
     * @param source HUMAN or AI; AI snapshots start out pending approval
     * @param note   optional free text stored with the version
     */
    Mono<SnapshotSaveResponse> saveSnapshot(String tenantId, JsonNode payload, String actorId,
                                            SnapshotSource source, String note);

    /**
     * Decrypts the newest version, bypassing the view cache
     */
    Mono<JsonNode> getLatestSnapshot(String tenantId, String actorId);

    Mono<JsonNode> getSnapshotVersion(String tenantId, int version, String actorId);

    Mono<SnapshotPage> listVersions(String tenantId, Integer fromVersion, Integer toVersion,
                                    Integer cursor, Integer limit);

    Flux<AuditTrailEntry> listAuditTrail(String tenantId, Instant from, Instant to);

    Mono<JsonNode> getCachedView(String tenantId, String viewName);

    Mono<Integer> getActiveKeyVersion(String tenantId);

    /**
     * Makes the next key version current for new writes. Stored snapshots are untouched.
     */
    Mono<KeyRotationResponse> rotateKey(String tenantId, String actorId);

    /**
     * Re-saves, oldest first, every snapshot encrypted under an older key version
     * as a new version under the current one
     */
    Mono<ReencryptionResponse> reencrypt(String tenantId, String actorId);

    /**
     * Re-saves the payload of {@code version} as a new version and records a ROLLBACK entry
     */
    Mono<SnapshotSaveResponse> rollbackToVersion(String tenantId, int version, String actorId, String note);

    Mono<ApprovalStatusResponse> approveSnapshot(String tenantId, int version, String actorId, String comment);

    Mono<ApprovalStatusResponse> rejectSnapshot(String tenantId, int version, String actorId, String comment);

    Mono<ApprovalStatusResponse> getApprovalStatus(String tenantId, int version);
}
