package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.ArchivalResult;
import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.exception.AuditException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.repository.SnapshotAuditLogRepository;
import org.lite.snapshot.service.AuditArchivalService;
import org.lite.snapshot.util.TenantIds;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditArchivalServiceImpl implements AuditArchivalService {

    static final String ARCHIVE_COLLECTION_PREFIX = "bia_audit_logs_archive_";
    private static final Pattern PARTITION_KEY = Pattern.compile("\\d{4}-(0[1-9]|1[0-2])");

    private final SnapshotAuditLogRepository auditLogRepository;
    private final ReactiveMongoTemplate mongoTemplate;
    private final Clock clock;

    @Override
    public Mono<ArchivalResult> archiveOldLogs(int retentionDays) {
        if (retentionDays < 1) {
            return Mono.error(new ValidationException("Retention must be at least one day"));
        }
        Instant threshold = Instant.now(clock).minus(retentionDays, ChronoUnit.DAYS);
        log.info("Starting audit log archival for entries older than {} days (threshold: {})", retentionDays, threshold);

        return archiveLogsBefore(threshold)
                .doOnSuccess(result -> log.info("Archival completed: {} entries archived", result.getArchivedCount()))
                .doOnError(error -> log.error("Archival failed: {}", error.getMessage(), error));
    }

    @Override
    public Mono<ArchivalResult> archiveLogsBefore(Instant threshold) {
        return auditLogRepository.findLogsReadyForArchival(threshold)
                .collectList()
                .flatMap(logs -> {
                    if (logs.isEmpty()) {
                        log.info("No audit entries ready for archival");
                        return Mono.just(ArchivalResult.builder()
                                .threshold(threshold)
                                .archivedCount(0)
                                .partitions(Map.of())
                                .build());
                    }

                    Map<String, List<SnapshotAuditLog>> byPartition = logs.stream()
                            .collect(Collectors.groupingBy(this::partitionOf, TreeMap::new, Collectors.toList()));
                    log.info("Found {} entries ready for archival in {} partitions", logs.size(), byPartition.size());

                    // Partitions run one after another so a failure leaves later partitions untouched
                    return Flux.fromIterable(byPartition.entrySet())
                            .concatMap(entry -> archivePartition(entry.getKey(), entry.getValue())
                                    .map(count -> Map.entry(entry.getKey(), count)))
                            .collectMap(Map.Entry::getKey, Map.Entry::getValue, TreeMap::new)
                            .map(counts -> ArchivalResult.builder()
                                    .threshold(threshold)
                                    .archivedCount(counts.values().stream().mapToLong(Long::longValue).sum())
                                    .partitions(counts)
                                    .build());
                })
                .onErrorMap(e -> !(e instanceof AuditException), e -> new AuditException("Audit archival failed", e));
    }

    @Override
    public Flux<SnapshotAuditLog> queryArchived(String tenantId, String partitionKey) {
        if (!TenantIds.isValid(tenantId)) {
            return Flux.error(new ValidationException("Tenant id must be a UUID"));
        }
        if (partitionKey == null || !PARTITION_KEY.matcher(partitionKey).matches()) {
            return Flux.error(new ValidationException("Partition key must look like yyyy-MM"));
        }
        Query query = Query.query(Criteria.where("tenantId").is(tenantId))
                .with(Sort.by(Sort.Direction.DESC, "timestamp").and(Sort.by(Sort.Direction.DESC, "snapshotVersion")));
        return mongoTemplate.find(query, SnapshotAuditLog.class, archiveCollection(partitionKey));
    }

    private Mono<Long> archivePartition(String partitionKey, List<SnapshotAuditLog> logs) {
        Instant archivedAt = Instant.now(clock);
        List<SnapshotAuditLog> copies = logs.stream()
                .map(entry -> entry.toBuilder().partitionKey(partitionKey).archivedAt(archivedAt).build())
                .collect(Collectors.toList());
        String collection = archiveCollection(partitionKey);

        log.debug("Archiving {} entries to {}", copies.size(), collection);
        // save upserts by id, so a rerun after a failed delete overwrites the copies it already wrote
        return Flux.fromIterable(copies)
                .concatMap(copy -> mongoTemplate.save(copy, collection))
                .then(Mono.defer(() -> auditLogRepository.deleteAll(logs)))
                .thenReturn((long) logs.size())
                .doOnSuccess(count -> log.info("Archived {} entries into {}", count, collection));
    }

    private String partitionOf(SnapshotAuditLog entry) {
        return entry.getPartitionKey() != null
                ? entry.getPartitionKey()
                : AuditServiceImpl.partitionKeyOf(entry.getTimestamp());
    }

    static String archiveCollection(String partitionKey) {
        return ARCHIVE_COLLECTION_PREFIX + partitionKey.replace('-', '_');
    }
}
