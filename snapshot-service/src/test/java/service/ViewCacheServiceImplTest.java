package service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.SnapshotMetadata;
import org.lite.snapshot.enums.SnapshotSource;
import org.lite.snapshot.exception.CacheException;
import org.lite.snapshot.exception.ConfigurationException;
import org.lite.snapshot.exception.SnapshotNotFoundException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.model.MasterSecret;
import org.lite.snapshot.service.CacheService;
import org.lite.snapshot.service.SnapshotPayloadCodec;
import org.lite.snapshot.service.ViewCacheService;
import org.lite.snapshot.service.impl.AesGcmEnvelopeCipherServiceImpl;
import org.lite.snapshot.service.impl.HkdfKeyDerivationServiceImpl;
import org.lite.snapshot.service.impl.InMemoryCacheServiceImpl;
import org.lite.snapshot.service.impl.InMemorySnapshotStoreServiceImpl;
import org.lite.snapshot.service.impl.SnapshotPayloadCodecImpl;
import org.lite.snapshot.service.impl.ViewCacheServiceImpl;
import org.lite.snapshot.service.view.HistoryViewComputer;
import org.lite.snapshot.service.view.SummaryViewComputer;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ViewCacheServiceImplTest {

    private static final String TENANT = "0f8fad5b-d9cb-469f-a165-70867728950e";

    @Mock
    private CacheService failingCache;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private SnapshotProperties properties;
    private InMemorySnapshotStoreServiceImpl store;
    private SnapshotPayloadCodec codec;

    @BeforeEach
    void setUp() {
        properties = new SnapshotProperties();
        properties.getCache().setMaxAttempts(3);
        properties.getCache().setInitialBackoff(Duration.ofMillis(1));

        store = new InMemorySnapshotStoreServiceImpl(clock);
        codec = new SnapshotPayloadCodecImpl(
                new HkdfKeyDerivationServiceImpl(MasterSecret.of("unit-test-master-secret")),
                new AesGcmEnvelopeCipherServiceImpl(),
                objectMapper);
    }

    @Test
    void testGetCachedView_MissComputesThenHits() {
        // Given
        InMemoryCacheServiceImpl cache = spy(new InMemoryCacheServiceImpl(clock));
        ViewCacheService viewCache = viewCache(cache);
        saveSnapshot("{\"processes\":[{\"name\":\"Payroll\"}],\"vendors\":[]}");

        // When - first call computes
        JsonNode first = viewCache.getCachedView(TENANT, "summary").block();

        // Then
        assertNotNull(first);
        assertEquals(1, first.get("version").asInt());
        assertEquals("processes", first.get("sections").get(0).asText());
        verify(cache).set(eq(ViewCacheService.cacheKey(TENANT, "summary", 1)), anyString(), any(Duration.class));
        StepVerifier.create(viewCache.get(TENANT, "summary", 1))
                .assertNext(cached -> assertTrue(cached.contains("\"metadata\"")))
                .verifyComplete();

        // second call is served from cache
        JsonNode second = viewCache.getCachedView(TENANT, "summary").block();
        assertEquals(first, second);
        verify(cache, times(1)).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testGetCachedView_NewVersionUsesNewKey() {
        InMemoryCacheServiceImpl cache = new InMemoryCacheServiceImpl(clock);
        ViewCacheService viewCache = viewCache(cache);
        saveSnapshot("{\"a\":1}");
        viewCache.getCachedView(TENANT, "summary").block();

        saveSnapshot("{\"b\":2}");
        JsonNode view = viewCache.getCachedView(TENANT, "summary").block();

        assertNotNull(view);
        assertEquals(2, view.get("version").asInt());
        assertEquals("b", view.get("sections").get(0).asText());
    }

    @Test
    void testGetCachedView_HistoryView() {
        ViewCacheService viewCache = viewCache(new InMemoryCacheServiceImpl(clock));
        saveSnapshot("{\"a\":1}");
        saveSnapshot("{\"a\":2}");
        saveSnapshot("{\"a\":3}");

        JsonNode history = viewCache.getCachedView(TENANT, "history").block();

        assertNotNull(history);
        assertEquals(3, history.get("latestVersion").asInt());
        assertEquals(3, history.get("versions").size());
        assertEquals(3, history.get("versions").get(0).get("version").asInt());
    }

    @Test
    void testGetCachedView_CacheOutageStillServesView() {
        // Given
        AtomicInteger setAttempts = new AtomicInteger();
        when(failingCache.get(anyString())).thenReturn(Mono.error(new CacheException("redis down", null)));
        when(failingCache.set(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.defer(() -> {
            setAttempts.incrementAndGet();
            return Mono.error(new CacheException("redis down", null));
        }));
        ViewCacheService viewCache = viewCache(failingCache);
        saveSnapshot("{\"processes\":[]}");

        // When & Then
        StepVerifier.create(viewCache.getCachedView(TENANT, "summary"))
                .assertNext(view -> assertEquals(TENANT, view.get("tenantId").asText()))
                .verifyComplete();
        assertEquals(3, setAttempts.get());
    }

    @Test
    void testInvalidate_FailureReturnsZero() {
        when(failingCache.deleteMatching(anyString())).thenReturn(Mono.error(new CacheException("redis down", null)));
        ViewCacheService viewCache = viewCache(failingCache);

        StepVerifier.create(viewCache.invalidate(TENANT, "*"))
                .expectNext(0L)
                .verifyComplete();
        verify(failingCache).deleteMatching("bia:" + TENANT + ":*:v*");
    }

    @Test
    void testInvalidate_RemovesOnlyTenantViews() {
        InMemoryCacheServiceImpl cache = new InMemoryCacheServiceImpl(clock);
        ViewCacheService viewCache = viewCache(cache);
        String otherTenant = "7c9e6679-7425-40de-944b-e07fc1f90ae7";
        viewCache.set(TENANT, "summary", 1, "{}", Duration.ofMinutes(5)).block();
        viewCache.set(TENANT, "history", 1, "{}", Duration.ofMinutes(5)).block();
        viewCache.set(otherTenant, "summary", 1, "{}", Duration.ofMinutes(5)).block();

        StepVerifier.create(viewCache.invalidate(TENANT, "*")).expectNext(2L).verifyComplete();
        StepVerifier.create(viewCache.get(otherTenant, "summary", 1)).expectNext("{}").verifyComplete();
    }

    @Test
    void testGetCachedView_UnknownViewAndMissingSnapshot() {
        ViewCacheService viewCache = viewCache(new InMemoryCacheServiceImpl(clock));

        StepVerifier.create(viewCache.getCachedView(TENANT, "nope"))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(viewCache.getCachedView(TENANT, "summary"))
                .expectError(SnapshotNotFoundException.class)
                .verify();
    }

    @Test
    void testConstructor_RejectsDuplicateViewNames() {
        assertThrows(ConfigurationException.class, () -> new ViewCacheServiceImpl(
                new InMemoryCacheServiceImpl(clock), store, codec, properties, objectMapper, clock,
                List.of(new SummaryViewComputer(objectMapper), new SummaryViewComputer(objectMapper))));
    }

    @Test
    void testCacheKey_Format() {
        assertEquals("bia:" + TENANT + ":summary:v7", ViewCacheService.cacheKey(TENANT, "summary", 7));
    }

    private ViewCacheService viewCache(CacheService cacheService) {
        return new ViewCacheServiceImpl(cacheService, store, codec, properties, objectMapper, clock,
                List.of(new SummaryViewComputer(objectMapper),
                        new HistoryViewComputer(store, properties, objectMapper)));
    }

    private void saveSnapshot(String json) {
        try {
            ObjectNode payload = (ObjectNode) objectMapper.readTree(json);
            int next = store.latestVersion(TENANT).block() + 1;
            store.append(TENANT, codec.seal(TENANT, 1, codec.serialize(payload)),
                    SnapshotMetadata.builder()
                            .savedBy("alice")
                            .source(SnapshotSource.HUMAN)
                            .recordCount(payload.size())
                            .notes("v" + next)
                            .build())
                    .block();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
