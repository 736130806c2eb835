package org.lite.snapshot.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.enums.SnapshotSource;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotSaveRequest {

    /**
     * The full BIA dataset to store as the next version
     */
    @NotNull
    private JsonNode data;

    @Builder.Default
    private SnapshotSource source = SnapshotSource.HUMAN;

    @Size(max = 2000)
    private String notes;
}
