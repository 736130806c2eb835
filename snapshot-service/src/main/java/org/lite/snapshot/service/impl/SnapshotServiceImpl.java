package org.lite.snapshot.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.ApprovalStatusResponse;
import org.lite.snapshot.dto.AuditTrailEntry;
import org.lite.snapshot.dto.KeyRotationResponse;
import org.lite.snapshot.dto.ReencryptionResponse;
import org.lite.snapshot.dto.SnapshotMetadata;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSaveResponse;
import org.lite.snapshot.dto.VersionRange;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.enums.ApprovalStatus;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;
import org.lite.snapshot.enums.SaveStage;
import org.lite.snapshot.enums.SnapshotSource;
import org.lite.snapshot.exception.EnvelopeAuthenticationException;
import org.lite.snapshot.exception.EnvelopeFormatException;
import org.lite.snapshot.exception.IntegrityException;
import org.lite.snapshot.exception.PartialFailureException;
import org.lite.snapshot.exception.SnapshotNotFoundException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.service.AuditService;
import org.lite.snapshot.service.KeyVersionService;
import org.lite.snapshot.service.SnapshotPayloadCodec;
import org.lite.snapshot.service.SnapshotService;
import org.lite.snapshot.service.SnapshotStoreService;
import org.lite.snapshot.service.ViewCacheService;
import org.lite.snapshot.util.TenantIds;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotServiceImpl implements SnapshotService {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final String SYSTEM_ACTOR = "system";

    private final SnapshotStoreService snapshotStoreService;
    private final SnapshotPayloadCodec payloadCodec;
    private final KeyVersionService keyVersionService;
    private final AuditService auditService;
    private final ViewCacheService viewCacheService;
    private final SnapshotProperties properties;
    private final Clock clock;

    /**
     * Everything a single save needs once the input has been validated
     */
    private record SaveCommand(String tenantId,
                               byte[] plaintext,
                               String actorId,
                               SnapshotSource source,
                               String notes,
                               int recordCount,
                               String requestId,
                               AuditAction action,
                               Map<String, Object> extraDetails) {
    }

    @Override
    public Mono<SnapshotSaveResponse> saveSnapshot(String tenantId, JsonNode payload, String actorId,
                                                   SnapshotSource source, String note) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateActor(actorId);
            validatePayload(payload);
            byte[] plaintext = payloadCodec.serialize(payload);
            if (plaintext.length > properties.getMaxPayloadBytes()) {
                throw new ValidationException(String.format("Payload is %d bytes, the limit is %d",
                        plaintext.length, properties.getMaxPayloadBytes()));
            }
            SaveCommand command = new SaveCommand(tenantId, plaintext, actorId,
                    source != null ? source : SnapshotSource.HUMAN, note, recordCount(payload),
                    UUID.randomUUID().toString(), AuditAction.SAVE, Map.of());
            return persist(command);
        });
    }

    @Override
    public Mono<JsonNode> getLatestSnapshot(String tenantId, String actorId) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            return snapshotStoreService.fetchLatest(tenantId)
                    .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId)))
                    .flatMap(snapshot -> openAndAudit(snapshot, actorId));
        });
    }

    @Override
    public Mono<JsonNode> getSnapshotVersion(String tenantId, int version, String actorId) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateVersion(version);
            return snapshotStoreService.fetchVersion(tenantId, version)
                    .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId, version)))
                    .flatMap(snapshot -> openAndAudit(snapshot, actorId));
        });
    }

    @Override
    public Mono<SnapshotPage> listVersions(String tenantId, Integer fromVersion, Integer toVersion,
                                           Integer cursor, Integer limit) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            if (cursor != null && cursor < 1) {
                throw new ValidationException("Cursor must be a positive version");
            }
            int pageSize = limit != null ? limit : DEFAULT_PAGE_SIZE;
            if (pageSize < 1 || pageSize > properties.getStore().getMaxPageSize()) {
                throw new ValidationException("Limit must be between 1 and " + properties.getStore().getMaxPageSize());
            }
            return snapshotStoreService.listVersions(tenantId, new VersionRange(fromVersion, toVersion), cursor, pageSize);
        });
    }

    @Override
    public Flux<AuditTrailEntry> listAuditTrail(String tenantId, Instant from, Instant to) {
        return Flux.defer(() -> {
            validateTenant(tenantId);
            if (from != null && to != null && from.isAfter(to)) {
                throw new ValidationException("Audit window start is after its end");
            }
            return auditService.getAuditTrail(tenantId, from, to);
        });
    }

    @Override
    public Mono<JsonNode> getCachedView(String tenantId, String viewName) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            return viewCacheService.getCachedView(tenantId, viewName);
        });
    }

    @Override
    public Mono<Integer> getActiveKeyVersion(String tenantId) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            return keyVersionService.getCurrentKeyVersion(tenantId);
        });
    }

    @Override
    public Mono<KeyRotationResponse> rotateKey(String tenantId, String actorId) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateActor(actorId);
            return keyVersionService.getCurrentKeyVersion(tenantId)
                    .flatMap(previous -> keyVersionService.rotateKey(tenantId, actorId)
                            .flatMap(rotated -> {
                                Map<String, Object> details = new LinkedHashMap<>();
                                details.put("previousKeyVersion", previous);
                                details.put("keyVersion", rotated.getVersion());
                                SnapshotAuditLog entry = SnapshotAuditLog.builder()
                                        .tenantId(tenantId)
                                        .action(AuditAction.KEY_ROTATE)
                                        .result(AuditResult.SUCCESS)
                                        .actorId(actorId)
                                        .details(details)
                                        .summary(String.format("Rotated key version %d -> %d",
                                                previous, rotated.getVersion()))
                                        .timestamp(rotated.getCreatedAt())
                                        .build();
                                return auditService.record(entry)
                                        .thenReturn(KeyRotationResponse.builder()
                                                .tenantId(tenantId)
                                                .previousKeyVersion(previous)
                                                .keyVersion(rotated.getVersion())
                                                .rotatedBy(actorId)
                                                .rotatedAt(rotated.getCreatedAt())
                                                .build());
                            }))
                    .doOnSuccess(r -> log.info("Tenant {} now encrypts new snapshots with key version {}",
                            tenantId, r.getKeyVersion()));
        });
    }

    @Override
    public Mono<ReencryptionResponse> reencrypt(String tenantId, String actorId) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateActor(actorId);
            return keyVersionService.getCurrentKeyVersion(tenantId)
                    .flatMap(current -> snapshotStoreService.findEncryptedBefore(tenantId, current)
                            .collectList()
                            // one at a time, oldest first, so new versions keep the original order
                            .flatMapMany(Flux::fromIterable)
                            .concatMap(snapshot -> reencryptOne(snapshot, actorId)
                                    .map(saved -> Map.entry(snapshot.getVersion(), saved.getVersion())))
                            .collectList()
                            .map(pairs -> ReencryptionResponse.builder()
                                    .tenantId(tenantId)
                                    .keyVersion(current)
                                    .sourceVersions(pairs.stream().map(Map.Entry::getKey).toList())
                                    .newVersions(pairs.stream().map(Map.Entry::getValue).toList())
                                    .build()))
                    .doOnSuccess(r -> log.info("Re-encrypted {} snapshots of tenant {} under key version {}",
                            r.getSourceVersions().size(), tenantId, r.getKeyVersion()));
        });
    }

    @Override
    public Mono<SnapshotSaveResponse> rollbackToVersion(String tenantId, int version, String actorId, String note) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateVersion(version);
            validateActor(actorId);
            return snapshotStoreService.fetchVersion(tenantId, version)
                    .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId, version)))
                    .flatMap(snapshot -> {
                        JsonNode payload = payloadCodec.open(snapshot);
                        SaveCommand command = new SaveCommand(tenantId, payloadCodec.serialize(payload), actorId,
                                SnapshotSource.HUMAN,
                                note != null ? note : "Rollback to version " + version,
                                recordCount(payload), UUID.randomUUID().toString(), AuditAction.ROLLBACK,
                                Map.of("rolledBackFrom", version));
                        return persist(command);
                    });
        });
    }

    @Override
    public Mono<ApprovalStatusResponse> approveSnapshot(String tenantId, int version, String actorId, String comment) {
        return decide(tenantId, version, actorId, comment, AuditAction.APPROVE);
    }

    @Override
    public Mono<ApprovalStatusResponse> rejectSnapshot(String tenantId, int version, String actorId, String comment) {
        return decide(tenantId, version, actorId, comment, AuditAction.REJECT);
    }

    @Override
    public Mono<ApprovalStatusResponse> getApprovalStatus(String tenantId, int version) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateVersion(version);
            return snapshotStoreService.fetchVersion(tenantId, version)
                    .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId, version)))
                    .flatMap(snapshot -> auditService.findLatestDecision(tenantId, version)
                            .map(decision -> ApprovalStatusResponse.builder()
                                    .tenantId(tenantId)
                                    .version(version)
                                    .source(snapshot.getSource())
                                    .status(decision.getAction() == AuditAction.APPROVE
                                            ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED)
                                    .decidedBy(decision.getActorId())
                                    .decidedAt(decision.getTimestamp())
                                    .comment(decision.getDetails() != null
                                            ? (String) decision.getDetails().get("comment") : null)
                                    .build())
                            .defaultIfEmpty(ApprovalStatusResponse.builder()
                                    .tenantId(tenantId)
                                    .version(version)
                                    .source(snapshot.getSource())
                                    .status(initialApproval(snapshot.getSource()))
                                    .build()));
        });
    }

    // Save pipeline

    private Mono<SnapshotSaveResponse> persist(SaveCommand command) {
        String tenantId = command.tenantId();
        AtomicReference<SaveStage> stage = new AtomicReference<>(SaveStage.VALIDATING);
        AtomicReference<Integer> keyVersionUsed = new AtomicReference<>();

        enter(stage, SaveStage.DERIVING, command);
        return keyVersionService.getCurrentKeyVersion(tenantId)
                .map(keyVersion -> {
                    keyVersionUsed.set(keyVersion);
                    enter(stage, SaveStage.ENCRYPTING, command);
                    return payloadCodec.seal(tenantId, keyVersion, command.plaintext());
                })
                .flatMap(envelope -> {
                    enter(stage, SaveStage.APPENDING, command);
                    return snapshotStoreService.append(tenantId, envelope, SnapshotMetadata.builder()
                            .savedBy(command.actorId())
                            .source(command.source())
                            .recordCount(command.recordCount())
                            .notes(command.notes())
                            .build());
                })
                .flatMap(snapshot -> {
                    enter(stage, SaveStage.AUDITING, command);
                    return auditService.record(successEntry(command, snapshot))
                            .onErrorMap(e -> new PartialFailureException(tenantId, snapshot.getVersion(),
                                    snapshot.getId(), e))
                            .thenReturn(snapshot);
                })
                .flatMap(snapshot -> {
                    enter(stage, SaveStage.INVALIDATING, command);
                    return viewCacheService.invalidate(tenantId, "*").thenReturn(snapshot);
                })
                .map(snapshot -> {
                    enter(stage, SaveStage.DONE, command);
                    log.info("{} stored version {} for tenant {} (keyVersion {}, request {})",
                            command.action(), snapshot.getVersion(), tenantId, snapshot.getKeyVersion(),
                            command.requestId());
                    return SnapshotSaveResponse.builder()
                            .snapshotId(snapshot.getId())
                            .version(snapshot.getVersion())
                            .tenantId(tenantId)
                            .keyVersion(snapshot.getKeyVersion())
                            .savedAt(snapshot.getCreatedAt())
                            .requestId(command.requestId())
                            .approvalStatus(initialApproval(snapshot.getSource()))
                            .build();
                })
                .onErrorResume(e -> onSaveFailure(command, stage.get(), keyVersionUsed.get(), e))
                .doFinally(signal -> Arrays.fill(command.plaintext(), (byte) 0));
    }

    private Mono<SnapshotSaveResponse> onSaveFailure(SaveCommand command, SaveStage stage, Integer keyVersion,
                                                     Throwable error) {
        if (error instanceof PartialFailureException partial) {
            log.error("Snapshot version {} for tenant {} is stored but unaudited (request {})",
                    partial.getVersion(), command.tenantId(), command.requestId());
            return Mono.error(error);
        }

        log.error("{} failed for tenant {} at stage {}: {} (request {})", command.action(), command.tenantId(),
                stage, error.getClass().getSimpleName(), command.requestId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stage", stage.name());
        details.put("errorType", error.getClass().getSimpleName());
        details.put("source", command.source().name());
        details.put("dataKeysCount", command.recordCount());
        if (keyVersion != null) {
            details.put("keyVersion", keyVersion);
        }
        SnapshotAuditLog failure = SnapshotAuditLog.builder()
                .tenantId(command.tenantId())
                .action(AuditAction.SAVE_FAILED)
                .result(AuditResult.FAILED)
                .actorId(command.actorId())
                .requestId(command.requestId())
                .details(details)
                .summary(String.format("%s failed at %s", command.action(), stage))
                .build();

        // best effort: the original error is what the caller needs
        return auditService.record(failure)
                .onErrorResume(auditError -> {
                    log.warn("Could not record SAVE_FAILED for tenant {}: {}", command.tenantId(),
                            auditError.getClass().getSimpleName());
                    return Mono.empty();
                })
                .then(Mono.error(error));
    }

    private SnapshotAuditLog successEntry(SaveCommand command, BiaSnapshot snapshot) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", command.source().name());
        details.put("version", snapshot.getVersion());
        details.put("keyVersion", snapshot.getKeyVersion());
        details.put("requestId", command.requestId());
        details.put("dataKeysCount", command.recordCount());
        details.putAll(command.extraDetails());

        String summary = command.action() == AuditAction.ROLLBACK
                ? String.format("Rolled back to version %s as version %d", command.extraDetails().get("rolledBackFrom"),
                        snapshot.getVersion())
                : String.format("Saved version %d (%d records, %s)", snapshot.getVersion(), command.recordCount(),
                        command.source());

        return SnapshotAuditLog.builder()
                .tenantId(command.tenantId())
                .snapshotId(snapshot.getId())
                .snapshotVersion(snapshot.getVersion())
                .action(command.action())
                .result(AuditResult.SUCCESS)
                .actorId(command.actorId())
                .requestId(command.requestId())
                .details(details)
                .summary(summary)
                // same instant as the snapshot, so audit order follows version order
                .timestamp(snapshot.getCreatedAt())
                .build();
    }

    private void enter(AtomicReference<SaveStage> stage, SaveStage next, SaveCommand command) {
        SaveStage previous = stage.getAndSet(next);
        log.debug("Save {} for tenant {}: {} -> {}", command.requestId(), command.tenantId(), previous, next);
    }

    private Mono<SnapshotSaveResponse> reencryptOne(BiaSnapshot snapshot, String actorId) {
        return Mono.fromCallable(() -> payloadCodec.open(snapshot))
                .flatMap(payload -> {
                    Map<String, Object> extra = new LinkedHashMap<>();
                    extra.put("reencryptedFrom", snapshot.getVersion());
                    extra.put("previousKeyVersion", snapshot.getKeyVersion());
                    return persist(new SaveCommand(snapshot.getTenantId(), payloadCodec.serialize(payload), actorId,
                            snapshot.getSource() != null ? snapshot.getSource() : SnapshotSource.HUMAN,
                            "Re-encrypted from version " + snapshot.getVersion(),
                            recordCount(payload), UUID.randomUUID().toString(), AuditAction.SAVE, extra));
                });
    }

    // Reads

    private Mono<JsonNode> openAndAudit(BiaSnapshot snapshot, String actorId) {
        String actor = actorId != null && !actorId.isBlank() ? actorId : SYSTEM_ACTOR;
        return Mono.fromCallable(() -> payloadCodec.open(snapshot))
                .flatMap(payload -> auditRead(snapshot, actor, AuditResult.SUCCESS, null).thenReturn(payload))
                .onErrorResume(e -> e instanceof EnvelopeAuthenticationException
                                || e instanceof IntegrityException
                                || e instanceof EnvelopeFormatException,
                        e -> {
                            log.error("Snapshot version {} of tenant {} failed verification: {}",
                                    snapshot.getVersion(), snapshot.getTenantId(), e.getClass().getSimpleName());
                            return auditRead(snapshot, actor, AuditResult.FAILED, e).then(Mono.error(e));
                        });
    }

    private Mono<Void> auditRead(BiaSnapshot snapshot, String actorId, AuditResult result, Throwable error) {
        if (!properties.isAuditReads()) {
            return Mono.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("version", snapshot.getVersion());
        details.put("keyVersion", snapshot.getKeyVersion());
        if (error != null) {
            details.put("errorType", error.getClass().getSimpleName());
        }
        SnapshotAuditLog entry = SnapshotAuditLog.builder()
                .tenantId(snapshot.getTenantId())
                // failed reads do not reference the snapshot they could not verify
                .snapshotId(result == AuditResult.SUCCESS ? snapshot.getId() : null)
                .snapshotVersion(snapshot.getVersion())
                .action(AuditAction.READ)
                .result(result)
                .actorId(actorId)
                .details(details)
                .summary(result == AuditResult.SUCCESS
                        ? "Read version " + snapshot.getVersion()
                        : "Read of version " + snapshot.getVersion() + " failed verification")
                .build();
        return auditService.record(entry)
                .onErrorResume(e -> {
                    log.warn("READ audit skipped for tenant {}: {}", snapshot.getTenantId(), e.getClass().getSimpleName());
                    return Mono.empty();
                })
                .then();
    }

    // Approval

    private Mono<ApprovalStatusResponse> decide(String tenantId, int version, String actorId, String comment,
                                                AuditAction decision) {
        return Mono.defer(() -> {
            validateTenant(tenantId);
            validateVersion(version);
            validateActor(actorId);
            return snapshotStoreService.fetchVersion(tenantId, version)
                    .switchIfEmpty(Mono.error(() -> new SnapshotNotFoundException(tenantId, version)))
                    .flatMap(snapshot -> {
                        Instant decidedAt = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("source", snapshot.getSource() != null ? snapshot.getSource().name() : null);
                        if (comment != null) {
                            details.put("comment", comment);
                        }
                        SnapshotAuditLog entry = SnapshotAuditLog.builder()
                                .tenantId(tenantId)
                                .snapshotId(snapshot.getId())
                                .snapshotVersion(version)
                                .action(decision)
                                .result(AuditResult.SUCCESS)
                                .actorId(actorId)
                                .details(details)
                                .summary(String.format("%s version %d",
                                        decision == AuditAction.APPROVE ? "Approved" : "Rejected", version))
                                .timestamp(decidedAt)
                                .build();
                        return auditService.record(entry)
                                .thenReturn(ApprovalStatusResponse.builder()
                                        .tenantId(tenantId)
                                        .version(version)
                                        .source(snapshot.getSource())
                                        .status(decision == AuditAction.APPROVE
                                                ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED)
                                        .decidedBy(actorId)
                                        .decidedAt(decidedAt)
                                        .comment(comment)
                                        .build());
                    })
                    .doOnSuccess(r -> log.info("Tenant {} version {} {} by {}", tenantId, version, r.getStatus(), actorId));
        });
    }

    private static ApprovalStatus initialApproval(SnapshotSource source) {
        return source == SnapshotSource.AI ? ApprovalStatus.PENDING : ApprovalStatus.APPROVED;
    }

    // Validation

    private static void validateTenant(String tenantId) {
        TenantIds.requireValid(tenantId);
    }

    private static void validateActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required");
        }
    }

    private static void validateVersion(int version) {
        if (version < 1) {
            throw new ValidationException("Version must be 1 or greater");
        }
    }

    private static void validatePayload(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new ValidationException("Payload is empty");
        }
        if ((payload.isContainerNode() && payload.isEmpty())
                || (payload.isTextual() && payload.asText().isBlank())) {
            throw new ValidationException("Payload is empty");
        }
    }

    /**
     * Top-level entries of the document: object fields or array elements, 1 for a scalar
     */
    static int recordCount(JsonNode payload) {
        return payload.isContainerNode() ? payload.size() : 1;
    }
}
