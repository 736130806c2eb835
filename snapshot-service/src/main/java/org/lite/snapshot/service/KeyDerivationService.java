package org.lite.snapshot.service;

/**
 * Derives per-tenant, per-key-version data encryption keys (DEKs) from the master secret.
 *
 * DEKs are never stored: the same (tenant, keyVersion) always yields the same key,
 * so every historical snapshot can be decrypted by deriving its key again.
 */
public interface KeyDerivationService {

    int KEY_LENGTH = 32; // 256 bits

    /**
     * Derive the DEK for a tenant and key version.
     *
     * @param tenantId   Tenant (organization) identifier
     * @param keyVersion Key version, 1 or greater
     * @return a fresh 32-byte array owned by the caller, who must zero it after use
     * @throws org.lite.snapshot.exception.ValidationException if the tenant is blank or the version is below 1
     */
    byte[] deriveKey(String tenantId, int keyVersion);
}
