package org.lite.snapshot.service;

import org.lite.snapshot.dto.VaultFile;

/**
 * Reads the encrypted vault file from disk. Called once at startup to resolve the master secret.
 */
public interface VaultFileService {

    /**
     * @return the decrypted vault; an empty vault when the file does not exist
     */
    VaultFile loadVault();
}
