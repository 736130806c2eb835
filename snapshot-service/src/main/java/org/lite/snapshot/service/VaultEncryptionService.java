package org.lite.snapshot.service;

/**
 * Decrypts the vault file. Encryption is done by the vault-reader CLI.
 */
public interface VaultEncryptionService {

    /**
     * @param encryptedBytes 12-byte IV followed by AES-GCM ciphertext and tag
     * @param environment    environment whose key the file section was sealed with
     * @return the decrypted JSON document
     */
    String decrypt(byte[] encryptedBytes, String environment);
}
