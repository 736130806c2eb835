package org.lite.snapshot.service;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Read-through cache of derived views, keyed by tenant, view name and snapshot version.
 * Backend failures degrade to misses and never reach the caller.
 */
public interface ViewCacheService {

    /**
     * @return the cached view document, empty on miss or backend failure
     */
    Mono<String> get(String tenantId, String viewName, int version);

    Mono<Void> set(String tenantId, String viewName, int version, String payload, Duration ttl);

    /**
     * Removes cached views of the tenant whose name matches the glob ({@code *} for all)
     *
     * @return number of entries removed, 0 when the backend was unavailable
     */
    Mono<Long> invalidate(String tenantId, String viewNamePattern);

    /**
     * View of the tenant's latest snapshot, computed and cached on a miss
     *
     * @throws org.lite.snapshot.exception.ValidationException      (signalled) for an unknown view name
     * @throws org.lite.snapshot.exception.SnapshotNotFoundException (signalled) when the tenant has no snapshot
     */
    Mono<JsonNode> getCachedView(String tenantId, String viewName);

    static String cacheKey(String tenantId, String viewName, int version) {
        return String.format("bia:%s:%s:v%d", tenantId, viewName, version);
    }
}
