package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyRotationResponse {

    private String tenantId;
    private Integer previousKeyVersion;
    private Integer keyVersion;
    private String rotatedBy;
    private Instant rotatedAt;
}
