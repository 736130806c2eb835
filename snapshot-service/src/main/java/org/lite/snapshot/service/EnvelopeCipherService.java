package org.lite.snapshot.service;

import org.lite.snapshot.dto.Envelope;

/**
 * Authenticated encryption of opaque payload bytes.
 *
 * The cipher is key-version agnostic: {@link #encrypt} returns an envelope with key version 0
 * and the caller stamps the version it derived the key for.
 */
public interface EnvelopeCipherService {

    int NONCE_LENGTH = 12; // 96 bits for GCM
    int TAG_LENGTH = 16; // 128 bits

    /**
     * Encrypt plaintext under a fresh random nonce.
     *
     * @param plaintext Payload bytes
     * @param key       32-byte DEK
     * @return Envelope with ciphertext, tag, nonce and plaintext checksum
     */
    Envelope encrypt(byte[] plaintext, byte[] key);

    /**
     * Decrypt and verify an envelope.
     *
     * @param envelope Envelope produced by {@link #encrypt}
     * @param key      32-byte DEK for the envelope's key version
     * @return the plaintext
     * @throws org.lite.snapshot.exception.EnvelopeFormatException         if nonce or tag sizes are wrong
     * @throws org.lite.snapshot.exception.EnvelopeAuthenticationException if the GCM tag does not verify
     * @throws org.lite.snapshot.exception.IntegrityException              if the plaintext checksum does not match
     */
    byte[] decrypt(Envelope envelope, byte[] key);

    /**
     * @return lowercase hex SHA-256 of the given bytes
     */
    String checksum(byte[] plaintext);
}
