package org.lite.snapshot.repository;

import org.lite.snapshot.entity.TenantKeyVersion;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TenantKeyVersionRepository extends ReactiveMongoRepository<TenantKeyVersion, String> {

    Mono<TenantKeyVersion> findFirstByTenantIdAndActiveTrueOrderByVersionDesc(String tenantId);

    Flux<TenantKeyVersion> findAllByTenantIdOrderByVersionAsc(String tenantId);
}
