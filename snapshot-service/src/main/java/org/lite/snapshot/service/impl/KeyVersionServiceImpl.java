package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.entity.TenantKeyVersion;
import org.lite.snapshot.exception.SnapshotVaultException;
import org.lite.snapshot.exception.StorageException;
import org.lite.snapshot.exception.VersionConflictException;
import org.lite.snapshot.repository.TenantKeyVersionRepository;
import org.lite.snapshot.service.KeyVersionService;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class KeyVersionServiceImpl implements KeyVersionService {

    private final TenantKeyVersionRepository keyVersionRepository;
    private final SnapshotProperties properties;
    private final Clock clock;

    private final Map<String, Mono<Integer>> activeVersionCache = new ConcurrentHashMap<>();

    @Override
    public Mono<Integer> getCurrentKeyVersion(String tenantId) {
        return activeVersionCache.computeIfAbsent(tenantId, tid -> keyVersionRepository
                .findFirstByTenantIdAndActiveTrueOrderByVersionDesc(tid)
                .map(TenantKeyVersion::getVersion)
                .defaultIfEmpty(properties.getDefaultKeyVersion())
                .onErrorMap(e -> new StorageException("Key version lookup failed for tenant " + tid, e))
                // failures are not cached
                .cache(version -> properties.getKeyVersionCacheTtl(), error -> Duration.ZERO, () -> Duration.ZERO));
    }

    @Override
    public Mono<TenantKeyVersion> rotateKey(String tenantId, String actorId) {
        log.info("Initiating key rotation for tenant: {}", tenantId);
        return keyVersionRepository.findAllByTenantIdOrderByVersionAsc(tenantId)
                .collectList()
                .flatMap(keys -> {
                    int maxVersion = keys.stream()
                            .map(TenantKeyVersion::getVersion)
                            .max(Integer::compareTo)
                            .orElse(properties.getDefaultKeyVersion());
                    int nextVersion = Math.max(maxVersion, properties.getDefaultKeyVersion()) + 1;

                    List<TenantKeyVersion> deactivated = keys.stream()
                            .filter(TenantKeyVersion::isActive)
                            .peek(k -> k.setActive(false))
                            .collect(Collectors.toList());

                    TenantKeyVersion next = TenantKeyVersion.builder()
                            .tenantId(tenantId)
                            .version(nextVersion)
                            .active(true)
                            .createdAt(Instant.now(clock))
                            .createdBy(actorId)
                            .build();

                    // new version first: the unique index rejects a concurrent rotation to the same version
                    return keyVersionRepository.insert(next)
                            .flatMap(saved -> keyVersionRepository.saveAll(deactivated).then(Mono.just(saved)));
                })
                .doOnSuccess(saved -> {
                    activeVersionCache.remove(tenantId);
                    log.info("Key rotation completed for tenant {}. New version: {}", tenantId, saved.getVersion());
                })
                .onErrorMap(DuplicateKeyException.class, e -> new VersionConflictException(tenantId, 1, e))
                .onErrorMap(e -> !(e instanceof SnapshotVaultException),
                        e -> new StorageException("Key rotation failed for tenant " + tenantId, e));
    }
}
