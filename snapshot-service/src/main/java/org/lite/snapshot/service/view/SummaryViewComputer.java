package org.lite.snapshot.service.view;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.lite.snapshot.entity.BiaSnapshot;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Version, size and top-level sections of the latest dataset
 */
@Component
@RequiredArgsConstructor
public class SummaryViewComputer implements ViewComputer {

    public static final String VIEW_NAME = "summary";

    private final ObjectMapper objectMapper;

    @Override
    public String getViewName() {
        return VIEW_NAME;
    }

    @Override
    public Mono<JsonNode> compute(BiaSnapshot snapshot, JsonNode payload) {
        return Mono.fromSupplier(() -> {
            ObjectNode view = objectMapper.createObjectNode();
            view.put("tenantId", snapshot.getTenantId());
            view.put("version", snapshot.getVersion());
            view.put("recordCount", snapshot.getRecordCount());
            view.put("source", snapshot.getSource() != null ? snapshot.getSource().name() : null);
            view.put("savedBy", snapshot.getSavedBy());
            view.put("createdAt", snapshot.getCreatedAt() != null ? snapshot.getCreatedAt().toString() : null);

            ArrayNode sections = view.putArray("sections");
            payload.fieldNames().forEachRemaining(sections::add);
            return view;
        });
    }
}
