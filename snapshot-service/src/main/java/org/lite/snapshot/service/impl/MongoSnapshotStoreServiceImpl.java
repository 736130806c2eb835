package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.dto.SnapshotMetadata;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSummary;
import org.lite.snapshot.dto.VersionRange;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.exception.SnapshotVaultException;
import org.lite.snapshot.exception.StorageException;
import org.lite.snapshot.exception.VersionConflictException;
import org.lite.snapshot.repository.BiaSnapshotRepository;
import org.lite.snapshot.service.SnapshotStoreService;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@Profile("!in-memory")
@RequiredArgsConstructor
@Slf4j
public class MongoSnapshotStoreServiceImpl implements SnapshotStoreService {

    private final BiaSnapshotRepository snapshotRepository;
    private final SnapshotProperties properties;
    private final Clock clock;

    @Override
    public Mono<BiaSnapshot> append(String tenantId, Envelope envelope, SnapshotMetadata metadata) {
        SnapshotProperties.Store store = properties.getStore();
        int maxAttempts = Math.max(1, store.getMaxAppendAttempts());

        return Mono.defer(() -> snapshotRepository.findFirstByTenantIdOrderByVersionDesc(tenantId)
                        .map(BiaSnapshot::getVersion)
                        .defaultIfEmpty(0)
                        .flatMap(latest -> {
                            BiaSnapshot snapshot = BiaSnapshot.fromEnvelope(envelope)
                                    .tenantId(tenantId)
                                    .version(latest + 1)
                                    .savedBy(metadata.getSavedBy())
                                    .source(metadata.getSource())
                                    .recordCount(metadata.getRecordCount())
                                    .notes(metadata.getNotes())
                                    // Mongo keeps millisecond precision
                                    .createdAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                                    .build();
                            // insert, never save: an existing (tenant, version) must fail on the unique index
                            return snapshotRepository.insert(snapshot);
                        }))
                .doOnError(DuplicateKeyException.class,
                        e -> log.debug("Version race for tenant {}, retrying append", tenantId))
                .retryWhen(Retry.backoff(maxAttempts - 1, store.getInitialBackoff())
                        .maxBackoff(store.getMaxBackoff())
                        .filter(DuplicateKeyException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) ->
                                new VersionConflictException(tenantId, maxAttempts, signal.failure())))
                .retryWhen(storageRetry())
                .onErrorMap(e -> !(e instanceof SnapshotVaultException),
                        e -> new StorageException("Failed to append snapshot for tenant " + tenantId, e))
                .doOnSuccess(saved -> log.info("Appended snapshot version {} for tenant {}",
                        saved.getVersion(), tenantId))
                .doOnError(e -> log.error("Append failed for tenant {}: {}", tenantId, e.getClass().getSimpleName()));
    }

    @Override
    public Mono<BiaSnapshot> fetchLatest(String tenantId) {
        return read(snapshotRepository.findFirstByTenantIdOrderByVersionDesc(tenantId), tenantId);
    }

    @Override
    public Mono<BiaSnapshot> fetchVersion(String tenantId, int version) {
        return read(snapshotRepository.findByTenantIdAndVersion(tenantId, version), tenantId);
    }

    @Override
    public Mono<Integer> latestVersion(String tenantId) {
        return fetchLatest(tenantId)
                .map(BiaSnapshot::getVersion)
                .defaultIfEmpty(0);
    }

    @Override
    public Mono<SnapshotPage> listVersions(String tenantId, VersionRange range, Integer cursor, int limit) {
        VersionRange effective = range != null ? range : VersionRange.all();
        int upper = cursor != null ? Math.min(effective.upperBound(), cursor - 1) : effective.upperBound();
        int lower = effective.lowerBound();
        if (upper < lower) {
            return Mono.just(SnapshotPage.of(List.of(), limit));
        }

        // one extra row tells whether another page exists
        PageRequest pageRequest = PageRequest.of(0, limit + 1, Sort.by(Sort.Direction.DESC, "version"));
        return snapshotRepository.findVersionRange(tenantId, lower, upper, pageRequest)
                .map(SnapshotSummary::fromEntity)
                .collectList()
                .map(rows -> SnapshotPage.of(rows, limit))
                .retryWhen(storageRetry())
                .onErrorMap(e -> !(e instanceof SnapshotVaultException),
                        e -> new StorageException("Failed to list snapshots for tenant " + tenantId, e));
    }

    @Override
    public Flux<BiaSnapshot> findEncryptedBefore(String tenantId, int keyVersion) {
        return snapshotRepository.findByTenantIdAndKeyVersionLessThanOrderByVersionAsc(tenantId, keyVersion)
                .onErrorMap(e -> !(e instanceof SnapshotVaultException),
                        e -> new StorageException("Failed to scan snapshots for tenant " + tenantId, e));
    }

    private Mono<BiaSnapshot> read(Mono<BiaSnapshot> query, String tenantId) {
        return query
                .retryWhen(storageRetry())
                .onErrorMap(e -> !(e instanceof SnapshotVaultException),
                        e -> new StorageException("Failed to read snapshot for tenant " + tenantId, e));
    }

    private Retry storageRetry() {
        SnapshotProperties.Store store = properties.getStore();
        return Retry.backoff(store.getMaxStorageRetries(), store.getInitialBackoff())
                .maxBackoff(store.getMaxBackoff())
                .filter(e -> e instanceof TransientDataAccessException
                        || e instanceof DataAccessResourceFailureException)
                .doBeforeRetry(signal -> log.warn("Retrying storage call after {} (attempt {})",
                        signal.failure().getClass().getSimpleName(), signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
