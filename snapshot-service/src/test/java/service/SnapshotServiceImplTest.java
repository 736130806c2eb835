package service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.ApprovalStatusResponse;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSaveResponse;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.entity.SnapshotAuditLog;
import org.lite.snapshot.entity.TenantKeyVersion;
import org.lite.snapshot.enums.ApprovalStatus;
import org.lite.snapshot.enums.AuditAction;
import org.lite.snapshot.enums.AuditResult;
import org.lite.snapshot.enums.SnapshotSource;
import org.lite.snapshot.exception.EnvelopeAuthenticationException;
import org.lite.snapshot.exception.IntegrityException;
import org.lite.snapshot.exception.PartialFailureException;
import org.lite.snapshot.exception.SnapshotNotFoundException;
import org.lite.snapshot.exception.StorageException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.model.MasterSecret;
import org.lite.snapshot.service.EnvelopeCipherService;
import org.lite.snapshot.service.KeyVersionService;
import org.lite.snapshot.service.SnapshotPayloadCodec;
import org.lite.snapshot.service.SnapshotService;
import org.lite.snapshot.service.ViewCacheService;
import org.lite.snapshot.service.impl.AesGcmEnvelopeCipherServiceImpl;
import org.lite.snapshot.service.impl.HkdfKeyDerivationServiceImpl;
import org.lite.snapshot.service.impl.InMemoryCacheServiceImpl;
import org.lite.snapshot.service.impl.InMemorySnapshotStoreServiceImpl;
import org.lite.snapshot.service.impl.SnapshotPayloadCodecImpl;
import org.lite.snapshot.service.impl.SnapshotServiceImpl;
import org.lite.snapshot.service.impl.ViewCacheServiceImpl;
import org.lite.snapshot.service.view.HistoryViewComputer;
import org.lite.snapshot.service.view.SummaryViewComputer;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotServiceImplTest {

    private static final String TENANT = "0f8fad5b-d9cb-469f-a165-70867728950e";
    private static final String OTHER_TENANT = "7c9e6679-7425-40de-944b-e07fc1f90ae7";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private KeyVersionService keyVersionService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final AtomicInteger activeKeyVersion = new AtomicInteger(1);

    private SnapshotProperties properties;
    private InMemorySnapshotStoreServiceImpl store;
    private EnvelopeCipherService cipherService;
    private RecordingAuditService auditService;
    private ViewCacheService viewCacheService;
    private SnapshotService snapshotService;

    @BeforeEach
    void setUp() {
        properties = new SnapshotProperties();
        store = spy(new InMemorySnapshotStoreServiceImpl(clock));
        cipherService = new AesGcmEnvelopeCipherServiceImpl();
        SnapshotPayloadCodec codec = new SnapshotPayloadCodecImpl(
                new HkdfKeyDerivationServiceImpl(MasterSecret.of("unit-test-master-secret")),
                cipherService, objectMapper);
        auditService = new RecordingAuditService(clock);
        viewCacheService = new ViewCacheServiceImpl(new InMemoryCacheServiceImpl(clock), store, codec, properties,
                objectMapper, clock, List.of(new SummaryViewComputer(objectMapper),
                        new HistoryViewComputer(store, properties, objectMapper)));

        lenient().when(keyVersionService.getCurrentKeyVersion(anyString()))
                .thenAnswer(invocation -> Mono.fromSupplier(activeKeyVersion::get));
        lenient().when(keyVersionService.rotateKey(anyString(), anyString()))
                .thenAnswer(invocation -> Mono.fromSupplier(() -> TenantKeyVersion.builder()
                        .tenantId(invocation.getArgument(0))
                        .version(activeKeyVersion.incrementAndGet())
                        .active(true)
                        .createdBy(invocation.getArgument(1))
                        .createdAt(NOW)
                        .build()));

        snapshotService = new SnapshotServiceImpl(store, codec, keyVersionService, auditService, viewCacheService,
                properties, clock);
    }

    @Test
    void testSaveSnapshot_FirstSaveIsVersionOne() {
        // When
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, json("{\"a\":1}"), "user-1", SnapshotSource.HUMAN, "init"))
                .assertNext(response -> {
                    assertEquals(1, response.getVersion());
                    assertEquals(TENANT, response.getTenantId());
                    assertEquals(1, response.getKeyVersion());
                    assertNotNull(response.getSnapshotId());
                    assertNotNull(response.getRequestId());
                    assertEquals(ApprovalStatus.APPROVED, response.getApprovalStatus());
                })
                .verifyComplete();

        // Then
        StepVerifier.create(snapshotService.getLatestSnapshot(TENANT, "user-1"))
                .expectNext(json("{\"a\":1}"))
                .verifyComplete();
    }

    @Test
    void testSaveSnapshot_StoresNoPlaintext() {
        snapshotService.saveSnapshot(TENANT, json("{\"secretProcess\":\"Payroll\"}"), "user-1",
                SnapshotSource.HUMAN, null).block();

        BiaSnapshot stored = store.fetchLatest(TENANT).block();
        assertNotNull(stored);
        String ciphertext = new String(Base64.getDecoder().decode(stored.getCiphertext()), StandardCharsets.UTF_8);
        assertFalse(ciphertext.contains("Payroll"));
        assertEquals("AES-256-GCM", stored.getAlgorithm());
    }

    @Test
    void testGetSnapshotVersion_ReturnsExactHistoricalPayload() {
        // Given
        save("{\"a\":1}");
        save("{\"a\":2}");
        save("{\"a\":3}");

        // When & Then
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 2, "user-1"))
                .expectNext(json("{\"a\":2}"))
                .verifyComplete();
    }

    @Test
    void testGetLatestSnapshot_NotFoundForNewTenant() {
        StepVerifier.create(snapshotService.getLatestSnapshot(OTHER_TENANT, "user-1"))
                .expectError(SnapshotNotFoundException.class)
                .verify();
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 4, "user-1"))
                .expectError(SnapshotNotFoundException.class)
                .verify();
    }

    @Test
    void testSaveSnapshot_ConcurrentSavesProduceGaplessVersions() {
        // Given
        save("{\"seed\":true}");
        int writers = 20;

        // When
        List<Integer> versions = Flux.range(0, writers)
                .flatMap(i -> snapshotService.saveSnapshot(TENANT, json("{\"writer\":" + i + "}"), "user-" + i,
                                SnapshotSource.HUMAN, null)
                        .subscribeOn(Schedulers.parallel()))
                .map(SnapshotSaveResponse::getVersion)
                .collectList()
                .block();

        // Then
        assertNotNull(versions);
        assertEquals(IntStream.rangeClosed(2, writers + 1).boxed().collect(Collectors.toList()),
                versions.stream().sorted().collect(Collectors.toList()));

        List<Integer> audited = auditService.entries(AuditAction.SAVE).stream()
                .map(SnapshotAuditLog::getSnapshotVersion)
                .sorted()
                .collect(Collectors.toList());
        assertEquals(IntStream.rangeClosed(1, writers + 1).boxed().collect(Collectors.toList()), audited);
    }

    @Test
    void testSaveSnapshot_WritesOneSaveAuditEntry() {
        // When
        SnapshotSaveResponse response = snapshotService.saveSnapshot(TENANT, json("{\"a\":1,\"b\":2}"), "user-1",
                SnapshotSource.HUMAN, "init").block();

        // Then
        assertNotNull(response);
        List<SnapshotAuditLog> saves = auditService.entries(AuditAction.SAVE);
        assertEquals(1, saves.size());
        SnapshotAuditLog entry = saves.get(0);
        assertEquals(response.getVersion(), entry.getSnapshotVersion());
        assertEquals(response.getSnapshotId(), entry.getSnapshotId());
        assertEquals("user-1", entry.getActorId());
        assertEquals(AuditResult.SUCCESS, entry.getResult());
        assertEquals(response.getSavedAt(), entry.getTimestamp());
        assertEquals("HUMAN", entry.getDetails().get("source"));
        assertEquals(2, entry.getDetails().get("dataKeysCount"));
        assertEquals(response.getRequestId(), entry.getDetails().get("requestId"));
    }

    @Test
    void testSaveSnapshot_RejectsInvalidInput() {
        properties.setMaxPayloadBytes(32);

        StepVerifier.create(snapshotService.saveSnapshot("not-a-uuid", json("{\"a\":1}"), "user-1", SnapshotSource.HUMAN, null))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, json("{}"), "user-1", SnapshotSource.HUMAN, null))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, null, "user-1", SnapshotSource.HUMAN, null))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, json("{\"a\":1}"), " ", SnapshotSource.HUMAN, null))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.saveSnapshot(TENANT,
                        json("{\"description\":\"" + "x".repeat(64) + "\"}"), "user-1", SnapshotSource.HUMAN, null))
                .expectError(ValidationException.class).verify();

        // nothing was stored or audited
        StepVerifier.create(store.latestVersion(TENANT)).expectNext(0).verifyComplete();
        assertTrue(auditService.entries().isEmpty());
    }

    @Test
    void testSaveSnapshot_AuditFailureAfterAppendIsPartialFailure() {
        // Given
        auditService.failWhen(entry -> entry.getAction() == AuditAction.SAVE);

        // When & Then
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, json("{\"a\":1}"), "user-1", SnapshotSource.HUMAN, null))
                .expectErrorSatisfies(error -> {
                    PartialFailureException partial = assertInstanceOf(PartialFailureException.class, error);
                    assertEquals(1, partial.getVersion());
                    assertEquals(TENANT, partial.getTenantId());
                    assertNotNull(partial.getSnapshotId());
                })
                .verify();

        // the snapshot stays durable
        StepVerifier.create(store.latestVersion(TENANT)).expectNext(1).verifyComplete();
        assertTrue(auditService.entries(AuditAction.SAVE_FAILED).isEmpty());
    }

    @Test
    void testSaveSnapshot_FailureBeforeAppendRecordsSaveFailed() {
        // Given
        when(keyVersionService.getCurrentKeyVersion(TENANT))
                .thenReturn(Mono.error(new StorageException("key registry down", null)));

        // When & Then
        StepVerifier.create(snapshotService.saveSnapshot(TENANT, json("{\"a\":1}"), "user-1", SnapshotSource.AI, null))
                .expectError(StorageException.class)
                .verify();

        List<SnapshotAuditLog> failures = auditService.entries(AuditAction.SAVE_FAILED);
        assertEquals(1, failures.size());
        assertEquals(AuditResult.FAILED, failures.get(0).getResult());
        assertEquals("DERIVING", failures.get(0).getDetails().get("stage"));
        assertEquals("StorageException", failures.get(0).getDetails().get("errorType"));
        assertEquals("AI", failures.get(0).getDetails().get("source"));
        StepVerifier.create(store.latestVersion(TENANT)).expectNext(0).verifyComplete();
    }

    @Test
    void testGetCachedView_RecomputedAfterSave() {
        // Given
        save("{\"processes\":[]}");
        JsonNode before = snapshotService.getCachedView(TENANT, "summary").block();
        assertNotNull(before);
        assertEquals(1, before.get("version").asInt());

        // When
        save("{\"vendors\":[]}");

        // Then
        StepVerifier.create(viewCacheService.get(TENANT, "summary", 1)).verifyComplete();
        StepVerifier.create(snapshotService.getCachedView(TENANT, "summary"))
                .assertNext(after -> {
                    assertEquals(2, after.get("version").asInt());
                    assertEquals("vendors", after.get("sections").get(0).asText());
                })
                .verifyComplete();
    }

    @Test
    void testRotateKey_OldSnapshotsStayReadable() {
        // Given
        save("{\"a\":1}");

        // When
        StepVerifier.create(snapshotService.rotateKey(TENANT, "admin"))
                .assertNext(rotation -> {
                    assertEquals(1, rotation.getPreviousKeyVersion());
                    assertEquals(2, rotation.getKeyVersion());
                    assertEquals("admin", rotation.getRotatedBy());
                })
                .verifyComplete();
        SnapshotSaveResponse second = save("{\"a\":2}");

        // Then
        assertEquals(2, second.getKeyVersion());
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 1, "user-1"))
                .expectNext(json("{\"a\":1}"))
                .verifyComplete();
        StepVerifier.create(snapshotService.getLatestSnapshot(TENANT, "user-1"))
                .expectNext(json("{\"a\":2}"))
                .verifyComplete();

        List<SnapshotAuditLog> rotations = auditService.entries(AuditAction.KEY_ROTATE);
        assertEquals(1, rotations.size());
        assertEquals(2, rotations.get(0).getDetails().get("keyVersion"));
    }

    @Test
    void testReencrypt_RewritesOlderKeyVersionsAsNewVersions() {
        // Given
        save("{\"a\":1}");
        snapshotService.rotateKey(TENANT, "admin").block();
        save("{\"a\":2}");

        // When
        StepVerifier.create(snapshotService.reencrypt(TENANT, "admin"))
                .assertNext(result -> {
                    assertEquals(2, result.getKeyVersion());
                    assertEquals(List.of(1), result.getSourceVersions());
                    assertEquals(List.of(3), result.getNewVersions());
                })
                .verifyComplete();

        // Then
        BiaSnapshot reencrypted = store.fetchVersion(TENANT, 3).block();
        assertNotNull(reencrypted);
        assertEquals(2, reencrypted.getKeyVersion());
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 3, "admin"))
                .expectNext(json("{\"a\":1}"))
                .verifyComplete();
        SnapshotAuditLog audit = auditService.entries(AuditAction.SAVE).stream()
                .filter(e -> e.getSnapshotVersion() == 3)
                .findFirst()
                .orElseThrow();
        assertEquals(1, audit.getDetails().get("reencryptedFrom"));
        assertEquals(1, audit.getDetails().get("previousKeyVersion"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetSnapshotVersion_AlteredChecksumIsIntegrityError() {
        // Given
        save("{\"a\":1}");
        save("{\"a\":2}");
        String otherChecksum = cipherService.checksum("{\"a\":9}".getBytes(StandardCharsets.UTF_8));
        doAnswer(invocation -> ((Mono<BiaSnapshot>) invocation.callRealMethod())
                .map(snapshot -> snapshot.toBuilder().checksum(otherChecksum).build()))
                .when(store).fetchVersion(TENANT, 2);

        // When & Then
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 2, "user-1"))
                .expectError(IntegrityException.class)
                .verify();

        SnapshotAuditLog failedRead = auditService.entries(AuditAction.READ).stream()
                .filter(e -> e.getResult() == AuditResult.FAILED)
                .findFirst()
                .orElseThrow();
        assertNull(failedRead.getSnapshotId());
        assertEquals("IntegrityException", failedRead.getDetails().get("errorType"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetLatestSnapshot_TamperedCiphertextFailsAuthentication() {
        // Given
        save("{\"a\":1}");
        doAnswer(invocation -> ((Mono<BiaSnapshot>) invocation.callRealMethod())
                .map(snapshot -> {
                    byte[] ciphertext = Base64.getDecoder().decode(snapshot.getCiphertext());
                    ciphertext[0] ^= 0x01;
                    return snapshot.toBuilder().ciphertext(Base64.getEncoder().encodeToString(ciphertext)).build();
                }))
                .when(store).fetchLatest(TENANT);

        // When & Then
        StepVerifier.create(snapshotService.getLatestSnapshot(TENANT, "user-1"))
                .expectError(EnvelopeAuthenticationException.class)
                .verify();
    }

    @Test
    void testRollbackToVersion_WritesOldPayloadAsNewVersion() {
        // Given
        save("{\"a\":1}");
        save("{\"a\":2}");

        // When
        StepVerifier.create(snapshotService.rollbackToVersion(TENANT, 1, "user-2", null))
                .assertNext(response -> assertEquals(3, response.getVersion()))
                .verifyComplete();

        // Then
        StepVerifier.create(snapshotService.getLatestSnapshot(TENANT, "user-2"))
                .expectNext(json("{\"a\":1}"))
                .verifyComplete();
        StepVerifier.create(snapshotService.getSnapshotVersion(TENANT, 2, "user-2"))
                .expectNext(json("{\"a\":2}"))
                .verifyComplete();

        List<SnapshotAuditLog> rollbacks = auditService.entries(AuditAction.ROLLBACK);
        assertEquals(1, rollbacks.size());
        assertEquals(3, rollbacks.get(0).getSnapshotVersion());
        assertEquals(1, rollbacks.get(0).getDetails().get("rolledBackFrom"));
        BiaSnapshot stored = store.fetchVersion(TENANT, 3).block();
        assertNotNull(stored);
        assertEquals("Rollback to version 1", stored.getNotes());
        assertEquals(SnapshotSource.HUMAN, stored.getSource());
    }

    @Test
    void testApproval_AiSnapshotsStartPending() {
        // Given
        SnapshotSaveResponse saved = snapshotService.saveSnapshot(TENANT, json("{\"a\":1}"), "assistant",
                SnapshotSource.AI, "suggested").block();
        assertNotNull(saved);
        assertEquals(ApprovalStatus.PENDING, saved.getApprovalStatus());

        StepVerifier.create(snapshotService.getApprovalStatus(TENANT, 1))
                .assertNext(status -> assertEquals(ApprovalStatus.PENDING, status.getStatus()))
                .verifyComplete();

        // When
        snapshotService.approveSnapshot(TENANT, 1, "reviewer", "looks right").block();

        // Then
        ApprovalStatusResponse status = snapshotService.getApprovalStatus(TENANT, 1).block();
        assertNotNull(status);
        assertEquals(ApprovalStatus.APPROVED, status.getStatus());
        assertEquals("reviewer", status.getDecidedBy());
        assertEquals("looks right", status.getComment());
        assertEquals(SnapshotSource.AI, status.getSource());
    }

    @Test
    void testApproval_RejectionOverridesEarlierApproval() {
        save("{\"a\":1}");

        snapshotService.approveSnapshot(TENANT, 1, "reviewer", null).block();
        snapshotService.rejectSnapshot(TENANT, 1, "auditor", "missing vendors").block();

        StepVerifier.create(snapshotService.getApprovalStatus(TENANT, 1))
                .assertNext(status -> {
                    assertEquals(ApprovalStatus.REJECTED, status.getStatus());
                    assertEquals("auditor", status.getDecidedBy());
                })
                .verifyComplete();
        StepVerifier.create(snapshotService.approveSnapshot(TENANT, 9, "reviewer", null))
                .expectError(SnapshotNotFoundException.class)
                .verify();
    }

    @Test
    void testApproval_SameInstantDecisionsResolveToLatestRecorded() {
        // Given - the fixed clock stamps every decision with the same instant
        save("{\"a\":1}");
        snapshotService.rejectSnapshot(TENANT, 1, "auditor", "missing vendors").block();

        // When
        snapshotService.approveSnapshot(TENANT, 1, "reviewer", "vendors added").block();

        // Then
        List<SnapshotAuditLog> decisions = auditService.entries().stream()
                .filter(e -> e.getAction() == AuditAction.APPROVE || e.getAction() == AuditAction.REJECT)
                .collect(Collectors.toList());
        assertEquals(2, decisions.size());
        assertEquals(decisions.get(0).getTimestamp(), decisions.get(1).getTimestamp());
        StepVerifier.create(snapshotService.getApprovalStatus(TENANT, 1))
                .assertNext(status -> {
                    assertEquals(ApprovalStatus.APPROVED, status.getStatus());
                    assertEquals("reviewer", status.getDecidedBy());
                })
                .verifyComplete();
    }

    @Test
    void testReads_AreAuditedUnlessDisabled() {
        save("{\"a\":1}");

        snapshotService.getLatestSnapshot(TENANT, null).block();
        List<SnapshotAuditLog> reads = auditService.entries(AuditAction.READ);
        assertEquals(1, reads.size());
        assertEquals("system", reads.get(0).getActorId());
        assertEquals(AuditResult.SUCCESS, reads.get(0).getResult());

        properties.setAuditReads(false);
        snapshotService.getLatestSnapshot(TENANT, "user-1").block();
        assertEquals(1, auditService.entries(AuditAction.READ).size());
    }

    @Test
    void testReads_SurviveAuditOutage() {
        save("{\"a\":1}");
        auditService.failWhen(entry -> entry.getAction() == AuditAction.READ);

        StepVerifier.create(snapshotService.getLatestSnapshot(TENANT, "user-1"))
                .expectNext(json("{\"a\":1}"))
                .verifyComplete();
    }

    @Test
    void testListVersions_PaginatesAndValidatesLimit() {
        for (int i = 1; i <= 3; i++) {
            save("{\"a\":" + i + "}");
        }

        SnapshotPage page = snapshotService.listVersions(TENANT, null, null, null, 2).block();
        assertNotNull(page);
        assertEquals(2, page.getContent().size());
        assertEquals(3, page.getContent().get(0).getVersion());
        assertTrue(page.isHasNext());

        StepVerifier.create(snapshotService.listVersions(TENANT, null, null, null, 0))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.listVersions(TENANT, null, null, null, 101))
                .expectError(ValidationException.class).verify();
        StepVerifier.create(snapshotService.listVersions(TENANT, null, null, 0, 10))
                .expectError(ValidationException.class).verify();
    }

    @Test
    void testListAuditTrail_NewestFirst() {
        save("{\"a\":1}");
        save("{\"a\":2}");

        StepVerifier.create(snapshotService.listAuditTrail(TENANT, null, null))
                .assertNext(entry -> {
                    assertEquals(AuditAction.SAVE, entry.action());
                    assertEquals(2, entry.snapshotVersion());
                    assertEquals("user-1", entry.actorId());
                })
                .assertNext(entry -> assertEquals(1, entry.snapshotVersion()))
                .verifyComplete();

        StepVerifier.create(snapshotService.listAuditTrail(TENANT, NOW, NOW.minusSeconds(1)))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void testGetActiveKeyVersion() {
        StepVerifier.create(snapshotService.getActiveKeyVersion(TENANT)).expectNext(1).verifyComplete();
        StepVerifier.create(snapshotService.getActiveKeyVersion("bad"))
                .expectError(ValidationException.class)
                .verify();
    }

    private SnapshotSaveResponse save(String payload) {
        return snapshotService.saveSnapshot(TENANT, json(payload), "user-1", SnapshotSource.HUMAN, null).block();
    }

    private JsonNode json(String value) {
        try {
            return objectMapper.readTree(value);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
