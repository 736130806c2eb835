package org.lite.snapshot.dto;

import lombok.Builder;
import lombok.Value;
import org.lite.snapshot.enums.SnapshotSource;

/**
 * Plaintext metadata stored next to an envelope
 */
@Value
@Builder
public class SnapshotMetadata {
    String savedBy;
    SnapshotSource source;
    int recordCount;
    String notes;
}
