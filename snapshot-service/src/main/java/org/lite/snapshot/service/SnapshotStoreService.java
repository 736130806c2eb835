package org.lite.snapshot.service;

import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.dto.SnapshotMetadata;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.VersionRange;
import org.lite.snapshot.entity.BiaSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only, versioned storage of encrypted snapshots. Versions start at 1
 * and increase by exactly one per tenant.
 */
public interface SnapshotStoreService {

    /**
     * Stores the envelope as version {@code latestVersion + 1}.
     *
     * @return the stored snapshot, carrying its id, version and createdAt
     */
    Mono<BiaSnapshot> append(String tenantId, Envelope envelope, SnapshotMetadata metadata);

    /**
     * @return the highest version, or empty when the tenant has none
     */
    Mono<BiaSnapshot> fetchLatest(String tenantId);

    Mono<BiaSnapshot> fetchVersion(String tenantId, int version);

    /**
     * @return the highest version, 0 when the tenant has none
     */
    Mono<Integer> latestVersion(String tenantId);

    /**
     * Newest first. {@code cursor}, when present, restricts the page to versions below it.
     */
    Mono<SnapshotPage> listVersions(String tenantId, VersionRange range, Integer cursor, int limit);

    /**
     * Snapshots written under a key version older than {@code keyVersion}, oldest first
     */
    Flux<BiaSnapshot> findEncryptedBefore(String tenantId, int keyVersion);
}
