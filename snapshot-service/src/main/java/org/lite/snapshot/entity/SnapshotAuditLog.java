package org.lite.snapshot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Audit trail of every action taken against a tenant's snapshots.
 * Hot entries live in bia_audit_logs; archival moves them to monthly partition collections.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "bia_audit_logs")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_timestamp_idx", def = "{'tenantId': 1, 'timestamp': -1, 'snapshotVersion': -1}"),
    @CompoundIndex(name = "tenant_action_timestamp_idx", def = "{'tenantId': 1, 'action': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "tenant_version_action_idx", def = "{'tenantId': 1, 'snapshotVersion': 1, 'action': 1}"),
    // For archival queries (entries not yet archived)
    @CompoundIndex(name = "not_archived_timestamp_idx", def = "{'archivedAt': 1, 'timestamp': 1}", sparse = true)
})
public class SnapshotAuditLog {

    @Id
    private String id;

    @Indexed(unique = true)
    private String eventId;

    /**
     * Null for failures that happened before a snapshot existed
     */
    private String snapshotId;

    private Integer snapshotVersion;

    private AuditAction action;

    private AuditResult result;

    private String actorId;

    private String tenantId;

    /**
     * Structured context: source, request id, record count, key versions, error class
     */
    private Map<String, Object> details;

    private String summary;

    private String requestId;

    private Instant timestamp;

    /**
     * yyyy-MM of the UTC timestamp
     */
    private String partitionKey;

    private Instant archivedAt;
}
