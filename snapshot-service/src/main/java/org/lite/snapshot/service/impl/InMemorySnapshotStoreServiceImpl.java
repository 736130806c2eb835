package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.dto.SnapshotMetadata;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSummary;
import org.lite.snapshot.dto.VersionRange;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.service.SnapshotStoreService;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

/**
 * Process-local snapshot store for local runs and tests.
 * Appends for one tenant are serialized by {@link ConcurrentHashMap#compute}.
 */
@Service
@Profile("in-memory")
@RequiredArgsConstructor
@Slf4j
public class InMemorySnapshotStoreServiceImpl implements SnapshotStoreService {

    private final Map<String, NavigableMap<Integer, BiaSnapshot>> snapshots = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public Mono<BiaSnapshot> append(String tenantId, Envelope envelope, SnapshotMetadata metadata) {
        return Mono.fromSupplier(() -> {
            BiaSnapshot[] appended = new BiaSnapshot[1];
            snapshots.compute(tenantId, (key, versions) -> {
                NavigableMap<Integer, BiaSnapshot> history = versions != null ? versions : new ConcurrentSkipListMap<>();
                int next = history.isEmpty() ? 1 : history.lastKey() + 1;
                BiaSnapshot snapshot = BiaSnapshot.fromEnvelope(envelope)
                        .id(UUID.randomUUID().toString())
                        .tenantId(tenantId)
                        .version(next)
                        .savedBy(metadata.getSavedBy())
                        .source(metadata.getSource())
                        .recordCount(metadata.getRecordCount())
                        .notes(metadata.getNotes())
                        .createdAt(Instant.now(clock))
                        .build();
                history.put(next, snapshot);
                appended[0] = snapshot;
                return history;
            });
            log.debug("Appended in-memory snapshot version {} for tenant {}", appended[0].getVersion(), tenantId);
            return copy(appended[0]);
        });
    }

    @Override
    public Mono<BiaSnapshot> fetchLatest(String tenantId) {
        return Mono.fromSupplier(() -> {
            NavigableMap<Integer, BiaSnapshot> history = snapshots.get(tenantId);
            if (history == null || history.isEmpty()) {
                return null;
            }
            return copy(history.lastEntry().getValue());
        });
    }

    @Override
    public Mono<BiaSnapshot> fetchVersion(String tenantId, int version) {
        return Mono.fromSupplier(() -> {
            NavigableMap<Integer, BiaSnapshot> history = snapshots.get(tenantId);
            BiaSnapshot snapshot = history != null ? history.get(version) : null;
            return snapshot != null ? copy(snapshot) : null;
        });
    }

    @Override
    public Mono<Integer> latestVersion(String tenantId) {
        return fetchLatest(tenantId)
                .map(BiaSnapshot::getVersion)
                .defaultIfEmpty(0);
    }

    @Override
    public Mono<SnapshotPage> listVersions(String tenantId, VersionRange range, Integer cursor, int limit) {
        return Mono.fromSupplier(() -> {
            VersionRange effective = range != null ? range : VersionRange.all();
            int upper = cursor != null ? Math.min(effective.upperBound(), cursor - 1) : effective.upperBound();
            int lower = effective.lowerBound();
            NavigableMap<Integer, BiaSnapshot> history = snapshots.get(tenantId);
            if (history == null || upper < lower) {
                return SnapshotPage.of(List.of(), limit);
            }
            List<SnapshotSummary> rows = history.subMap(lower, true, upper, true)
                    .descendingMap()
                    .values()
                    .stream()
                    .limit(limit + 1L)
                    .map(SnapshotSummary::fromEntity)
                    .collect(Collectors.toList());
            return SnapshotPage.of(rows, limit);
        });
    }

    @Override
    public Flux<BiaSnapshot> findEncryptedBefore(String tenantId, int keyVersion) {
        return Flux.defer(() -> {
            NavigableMap<Integer, BiaSnapshot> history = snapshots.get(tenantId);
            if (history == null) {
                return Flux.empty();
            }
            return Flux.fromIterable(List.copyOf(history.values()))
                    .filter(snapshot -> snapshot.getKeyVersion() < keyVersion)
                    .map(this::copy);
        });
    }

    private BiaSnapshot copy(BiaSnapshot snapshot) {
        return snapshot.toBuilder().build();
    }
}
