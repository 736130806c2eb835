package org.lite.snapshot.service.view;

import com.fasterxml.jackson.databind.JsonNode;
import org.lite.snapshot.entity.BiaSnapshot;
import reactor.core.publisher.Mono;

/**
 * Derives a named, cacheable view from a decrypted snapshot.
 * Every Spring bean implementing this interface is served under {@link #getViewName()}.
 */
public interface ViewComputer {

    String getViewName();

    /**
     * @param snapshot metadata of the version the view is computed for
     * @param payload  decrypted document of that version
     */
    Mono<JsonNode> compute(BiaSnapshot snapshot, JsonNode payload);
}
