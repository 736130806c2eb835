package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.enums.SnapshotSource;

import java.time.Instant;

/**
 * Snapshot metadata without any encrypted material, used for history listings
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotSummary {

    private String snapshotId;
    private String tenantId;
    private Integer version;
    private Integer keyVersion;
    private String savedBy;
    private SnapshotSource source;
    private Instant createdAt;
    private Integer recordCount;
    private String notes;

    public static SnapshotSummary fromEntity(BiaSnapshot snapshot) {
        return SnapshotSummary.builder()
                .snapshotId(snapshot.getId())
                .tenantId(snapshot.getTenantId())
                .version(snapshot.getVersion())
                .keyVersion(snapshot.getKeyVersion())
                .savedBy(snapshot.getSavedBy())
                .source(snapshot.getSource())
                .createdAt(snapshot.getCreatedAt())
                .recordCount(snapshot.getRecordCount())
                .notes(snapshot.getNotes())
                .build();
    }
}
