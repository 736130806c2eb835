package org.lite.snapshot.dto;

import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;

import java.time.Instant;

/**
 * Caller-facing view of one audit entry
 */
public record AuditTrailEntry(AuditAction action,
                              String actorId,
                              Instant timestamp,
                              String summary,
                              Integer snapshotVersion,
                              AuditResult result) {

    public static AuditTrailEntry fromEntity(SnapshotAuditLog entry) {
        return new AuditTrailEntry(entry.getAction(), entry.getActorId(), entry.getTimestamp(),
                entry.getSummary(), entry.getSnapshotVersion(), entry.getResult());
    }
}
