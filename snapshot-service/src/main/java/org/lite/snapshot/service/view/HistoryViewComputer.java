package org.lite.snapshot.service.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.VersionRange;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.service.SnapshotStoreService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Metadata of the most recent versions up to and including the snapshot the view is computed for
 */
@Component
@RequiredArgsConstructor
public class HistoryViewComputer implements ViewComputer {

    public static final String VIEW_NAME = "history";

    private final SnapshotStoreService snapshotStoreService;
    private final SnapshotProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getViewName() {
        return VIEW_NAME;
    }

    @Override
    public Mono<JsonNode> compute(BiaSnapshot snapshot, JsonNode payload) {
        int size = properties.getCache().getHistoryViewSize();
        // bounded by the computed version so the cached entry matches its key
        VersionRange range = new VersionRange(1, snapshot.getVersion());
        return snapshotStoreService.listVersions(snapshot.getTenantId(), range, null, size)
                .map(page -> {
                    ObjectNode view = objectMapper.createObjectNode();
                    view.put("tenantId", snapshot.getTenantId());
                    view.put("latestVersion", snapshot.getVersion());
                    ArrayNode versions = view.putArray("versions");
                    page.getContent().forEach(summary -> {
                        ObjectNode row = versions.addObject();
                        row.put("version", summary.getVersion());
                        row.put("keyVersion", summary.getKeyVersion());
                        row.put("savedBy", summary.getSavedBy());
                        row.put("source", summary.getSource() != null ? summary.getSource().name() : null);
                        row.put("recordCount", summary.getRecordCount());
                        row.put("createdAt", summary.getCreatedAt() != null ? summary.getCreatedAt().toString() : null);
                        row.put("notes", summary.getNotes());
                    });
                    return view;
                });
    }
}
