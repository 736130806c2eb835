package org.lite.snapshot.repository;

import org.lite.snapshot.entity.BiaSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface BiaSnapshotRepository extends ReactiveMongoRepository<BiaSnapshot, String> {

    Mono<BiaSnapshot> findFirstByTenantIdOrderByVersionDesc(String tenantId);

    Mono<BiaSnapshot> findByTenantIdAndVersion(String tenantId, Integer version);

    /**
     * Versions within [fromVersion, toVersion], ordering and limit come from the pageable
     */
    @Query("{ 'tenantId': ?0, 'version': { $gte: ?1, $lte: ?2 } }")
    Flux<BiaSnapshot> findVersionRange(String tenantId, Integer fromVersion, Integer toVersion, Pageable pageable);

    Flux<BiaSnapshot> findByTenantIdAndKeyVersionLessThanOrderByVersionAsc(String tenantId, Integer keyVersion);
}
