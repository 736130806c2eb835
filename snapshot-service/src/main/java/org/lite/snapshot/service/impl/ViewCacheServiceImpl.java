package org.lite.snapshot.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.exception.ConfigurationException;
import org.lite.snapshot.exception.SnapshotNotFoundException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.service.CacheService;
import org.lite.snapshot.service.SnapshotPayloadCodec;
import org.lite.snapshot.service.SnapshotStoreService;
import org.lite.snapshot.service.ViewCacheService;
import org.lite.snapshot.service.view.ViewComputer;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
public class ViewCacheServiceImpl implements ViewCacheService {

    private final CacheService cacheService;
    private final SnapshotStoreService snapshotStoreService;
    private final SnapshotPayloadCodec payloadCodec;
    private final SnapshotProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ViewComputer> computers = new TreeMap<>();

    public ViewCacheServiceImpl(CacheService cacheService,
                                SnapshotStoreService snapshotStoreService,
                                SnapshotPayloadCodec payloadCodec,
                                SnapshotProperties properties,
                                ObjectMapper objectMapper,
                                Clock clock,
                                List<ViewComputer> viewComputers) {
        this.cacheService = cacheService;
        this.snapshotStoreService = snapshotStoreService;
        this.payloadCodec = payloadCodec;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (ViewComputer computer : viewComputers) {
            if (computers.putIfAbsent(computer.getViewName(), computer) != null) {
                throw new ConfigurationException("Duplicate view computer for view " + computer.getViewName());
            }
        }
        log.info("Registered snapshot views: {}", computers.keySet());
    }

    @Override
    public Mono<String> get(String tenantId, String viewName, int version) {
        String key = ViewCacheService.cacheKey(tenantId, viewName, version);
        return cacheService.get(key)
                .doOnNext(hit -> log.debug("View cache hit: {}", key))
                .onErrorResume(e -> {
                    log.warn("View cache read failed for {}, treating as miss: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Void> set(String tenantId, String viewName, int version, String payload, Duration ttl) {
        String key = ViewCacheService.cacheKey(tenantId, viewName, version);
        return cacheService.set(key, payload, ttl)
                .retryWhen(cacheRetry())
                .onErrorResume(e -> {
                    log.warn("View cache write failed for {} after retries: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<Long> invalidate(String tenantId, String viewNamePattern) {
        String pattern = String.format("bia:%s:%s:v*", tenantId, viewNamePattern != null ? viewNamePattern : "*");
        return cacheService.deleteMatching(pattern)
                .retryWhen(cacheRetry())
                .doOnNext(count -> log.debug("Invalidated {} cached views matching {}", count, pattern))
                .onErrorResume(e -> {
                    // entries are version-keyed, so a missed invalidation only leaves unreachable keys until TTL
                    log.warn("View cache invalidation failed for {} after retries: {}", pattern, e.getMessage());
                    return Mono.just(0L);
                });
    }

    @Override
    public Mono<JsonNode> getCachedView(String tenantId, String viewName) {
        ViewComputer computer = computers.get(viewName);
        if (computer == null) {
            return Mono.error(new ValidationException("Unknown view: " + viewName + ", available: " + computers.keySet()));
        }

        return snapshotStoreService.fetchLatest(tenantId)
                .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId)))
                .flatMap(snapshot -> get(tenantId, viewName, snapshot.getVersion())
                        .flatMap(cached -> unwrap(cached, tenantId, viewName))
                        .switchIfEmpty(Mono.defer(() -> computeAndCache(computer, snapshot))));
    }

    private Mono<JsonNode> computeAndCache(ViewComputer computer, BiaSnapshot snapshot) {
        log.debug("View cache miss: {} v{} for tenant {}", computer.getViewName(), snapshot.getVersion(),
                snapshot.getTenantId());
        return Mono.fromCallable(() -> payloadCodec.open(snapshot))
                .flatMap(payload -> computer.compute(snapshot, payload))
                .flatMap(view -> wrap(view, snapshot, computer.getViewName())
                        .flatMap(serialized -> set(snapshot.getTenantId(), computer.getViewName(),
                                snapshot.getVersion(), serialized, properties.getCache().getViewTtl()))
                        .thenReturn(view));
    }

    private Mono<String> wrap(JsonNode view, BiaSnapshot snapshot, String viewName) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.set("data", view);
        ObjectNode metadata = entry.putObject("metadata");
        metadata.put("tenantId", snapshot.getTenantId());
        metadata.put("viewName", viewName);
        metadata.put("version", snapshot.getVersion());
        metadata.put("cachedAt", Instant.now(clock).toString());
        try {
            return Mono.just(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize view {} for caching: {}", viewName, e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<JsonNode> unwrap(String cached, String tenantId, String viewName) {
        try {
            return Mono.justOrEmpty(objectMapper.readTree(cached).get("data"));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cached view {} for tenant {}", viewName, tenantId);
            return Mono.empty();
        }
    }

    private Retry cacheRetry() {
        SnapshotProperties.Cache cache = properties.getCache();
        return Retry.backoff(Math.max(0, cache.getMaxAttempts() - 1), cache.getInitialBackoff())
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
