package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of migrating a tenant's history to the current key version.
 * {@code sourceVersions.get(i)} was re-saved as {@code newVersions.get(i)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReencryptionResponse {

    private String tenantId;
    private Integer keyVersion;
    private List<Integer> sourceVersions;
    private List<Integer> newVersions;
}
