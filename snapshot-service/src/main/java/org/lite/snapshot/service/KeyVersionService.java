package org.lite.snapshot.service;

import org.lite.snapshot.entity.TenantKeyVersion;
import reactor.core.publisher.Mono;

/**
 * Registry of the key version each tenant encrypts new snapshots with
 */
public interface KeyVersionService {

    /**
     * @return the active key version, or the configured default when the tenant never rotated
     */
    Mono<Integer> getCurrentKeyVersion(String tenantId);

    /**
     * Activates the next key version. Metadata only: existing snapshots keep their key version
     * and remain readable.
     *
     * @return the newly active version
     */
    Mono<TenantKeyVersion> rotateKey(String tenantId, String actorId);
}
