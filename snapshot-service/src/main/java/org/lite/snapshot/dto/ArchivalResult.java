package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one archival run: archived entry count per partition key
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivalResult {

    private Instant threshold;
    private long archivedCount;
    private Map<String, Long> partitions;
}
