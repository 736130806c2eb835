package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.AuditLogPageResponse;
import org.lite.snapshot.dto.AuditLogQueryRequest;
import org.lite.snapshot.dto.AuditLogResponse;
import org.lite.snapshot.dto.AuditTrailEntry;
import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;
import org.lite.snapshot.exception.AuditException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.repository.SnapshotAuditLogRepository;
import org.lite.snapshot.service.AuditService;
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
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditServiceImpl implements AuditService {

    public static final DateTimeFormatter PARTITION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private static final List<AuditAction> DECISIONS = List.of(AuditAction.APPROVE, AuditAction.REJECT);

    private static final int DEFAULT_PAGE_SIZE = 50;

    // _id last keeps pages stable when entries share a timestamp and version
    static final Sort NEWEST_FIRST_SORT = Sort.by(Sort.Direction.DESC, "timestamp")
            .and(Sort.by(Sort.Direction.DESC, "snapshotVersion"))
            .and(Sort.by(Sort.Direction.DESC, "_id"));

    private final SnapshotAuditLogRepository auditLogRepository;
    private final ReactiveMongoTemplate mongoTemplate;
    private final SnapshotProperties properties;
    private final Clock clock;

    @Override
    public Mono<String> record(SnapshotAuditLog entry) {
        Instant timestamp = entry.getTimestamp() != null
                ? entry.getTimestamp()
                : Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        SnapshotAuditLog auditLog = entry.toBuilder()
                .eventId(entry.getEventId() != null ? entry.getEventId() : UUID.randomUUID().toString())
                .timestamp(timestamp)
                .partitionKey(partitionKeyOf(timestamp))
                .result(entry.getResult() != null ? entry.getResult() : AuditResult.SUCCESS)
                .archivedAt(null)
                .build();

        return auditLogRepository.insert(auditLog)
                .map(SnapshotAuditLog::getEventId)
                .doOnSuccess(eventId -> log.debug("Audit event logged: {} {} by {} in tenant {}",
                        auditLog.getAction(), auditLog.getResult(), auditLog.getActorId(), auditLog.getTenantId()))
                .onErrorMap(e -> !(e instanceof AuditException), e -> {
                    log.error("Failed to save audit log {} for tenant {}: {}",
                            auditLog.getAction(), auditLog.getTenantId(), e.getClass().getSimpleName());
                    return new AuditException("Audit entry could not be recorded for tenant "
                            + auditLog.getTenantId(), e);
                });
    }

    @Override
    public Flux<SnapshotAuditLog> query(AuditLogQueryRequest request) {
        return Flux.defer(() -> mongoTemplate.find(buildQuery(request).with(NEWEST_FIRST_SORT), SnapshotAuditLog.class))
                .onErrorMap(e -> !(e instanceof ValidationException) && !(e instanceof AuditException),
                        e -> new AuditException("Audit query failed for tenant " + request.getTenantId(), e));
    }

    @Override
    public Mono<AuditLogPageResponse> queryPage(AuditLogQueryRequest request) {
        return Mono.defer(() -> {
            int page = request.getPage() != null ? Math.max(0, request.getPage()) : 0;
            int size = request.getSize() != null && request.getSize() > 0
                    ? Math.min(request.getSize(), properties.getStore().getMaxPageSize())
                    : DEFAULT_PAGE_SIZE;

            Query pageQuery = buildQuery(request)
                    .with(NEWEST_FIRST_SORT)
                    .skip((long) page * size)
                    .limit(size);
            Mono<Long> total = mongoTemplate.count(buildQuery(request), SnapshotAuditLog.class);
            Mono<List<AuditLogResponse>> content = mongoTemplate.find(pageQuery, SnapshotAuditLog.class)
                    .map(AuditLogResponse::fromEntity)
                    .collectList();

            return Mono.zip(content, total)
                    .map(tuple -> AuditLogPageResponse.of(request.getTenantId(), tuple.getT1(), page, size, tuple.getT2()));
        }).onErrorMap(e -> !(e instanceof ValidationException) && !(e instanceof AuditException),
                e -> new AuditException("Audit query failed for tenant " + request.getTenantId(), e));
    }

    @Override
    public Flux<AuditTrailEntry> getAuditTrail(String tenantId, Instant from, Instant to) {
        return query(AuditLogQueryRequest.builder()
                        .tenantId(tenantId)
                        .startTime(from)
                        .endTime(to)
                        .build())
                .map(AuditTrailEntry::fromEntity);
    }

    /**
     * Newest successful APPROVE or REJECT for one version. Entries recorded in the same millisecond
     * are ordered by id, so the later insert wins.
     */
    @Override
    public Mono<SnapshotAuditLog> findLatestDecision(String tenantId, int snapshotVersion) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                        .and("snapshotVersion").is(snapshotVersion)
                        .and("action").in(DECISIONS)
                        .and("result").is(AuditResult.SUCCESS))
                .with(Sort.by(Sort.Direction.DESC, "timestamp").and(Sort.by(Sort.Direction.DESC, "_id")))
                .limit(1);
        return mongoTemplate.findOne(query, SnapshotAuditLog.class)
                .onErrorMap(e -> new AuditException("Approval lookup failed for tenant " + tenantId, e));
    }

    /**
     * Tenant, time window and optional filters, all evaluated by MongoDB
     */
    private Query buildQuery(AuditLogQueryRequest request) {
        if (request == null) {
            throw new ValidationException("Audit queries require a tenantId");
        }
        TenantIds.requireValid(request.getTenantId());

        Instant endTime = request.getEndTime() != null ? request.getEndTime() : Instant.now(clock);
        Instant startTime = request.getStartTime() != null
                ? request.getStartTime()
                : endTime.minus(properties.getAudit().getDefaultQueryDays(), ChronoUnit.DAYS);
        if (startTime.isAfter(endTime)) {
            throw new ValidationException("Audit query start must not be after its end");
        }

        Criteria criteria = Criteria.where("tenantId").is(request.getTenantId())
                .and("timestamp").gte(startTime).lte(endTime);
        if (request.getActions() != null && !request.getActions().isEmpty()) {
            criteria = criteria.and("action").in(request.getActions());
        }
        if (request.getActorId() != null) {
            criteria = criteria.and("actorId").is(request.getActorId());
        }
        if (request.getResult() != null) {
            criteria = criteria.and("result").is(request.getResult());
        }
        if (request.getSnapshotVersion() != null) {
            criteria = criteria.and("snapshotVersion").is(request.getSnapshotVersion());
        }
        return Query.query(criteria);
    }

    public static String partitionKeyOf(Instant timestamp) {
        return PARTITION_FORMAT.format(timestamp);
    }
}
