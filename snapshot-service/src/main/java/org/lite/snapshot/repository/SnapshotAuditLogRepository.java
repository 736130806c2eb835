package org.lite.snapshot.repository;

import org.lite.snapshot.entity.SnapshotAuditLog;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Inserts and archival lookups. Filtered audit queries are built with Criteria in AuditServiceImpl.
 */
@Repository
public interface SnapshotAuditLogRepository extends ReactiveMongoRepository<SnapshotAuditLog, String> {

    /**
     * Entries older than the threshold that have not been archived yet
     */
    @Query("{ 'timestamp': { $lt: ?0 }, 'archivedAt': null }")
    Flux<SnapshotAuditLog> findLogsReadyForArchival(Instant threshold);
}
