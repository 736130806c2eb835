package org.lite.snapshot.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.exception.EnvelopeAuthenticationException;
import org.lite.snapshot.exception.EnvelopeFormatException;
import org.lite.snapshot.exception.IntegrityException;
import org.lite.snapshot.service.EnvelopeCipherService;
import org.lite.snapshot.service.KeyDerivationService;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * AES-256-GCM envelope cipher with an independent SHA-256 plaintext checksum.
 */
@Slf4j
@Service
public class AesGcmEnvelopeCipherServiceImpl implements EnvelopeCipherService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final Pattern CHECKSUM_PATTERN = Pattern.compile("[0-9a-f]{64}");

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public Envelope encrypt(byte[] plaintext, byte[] key) {
        requireKey(key);
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }

        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, nonce));

            // JCE appends the tag to the ciphertext
            byte[] sealed = cipher.doFinal(plaintext);
            int ciphertextLength = sealed.length - TAG_LENGTH;

            return Envelope.builder()
                    .nonce(nonce)
                    .ciphertext(Arrays.copyOfRange(sealed, 0, ciphertextLength))
                    .tag(Arrays.copyOfRange(sealed, ciphertextLength, sealed.length))
                    .checksum(checksum(plaintext))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    @Override
    public byte[] decrypt(Envelope envelope, byte[] key) {
        requireKey(key);
        validateFormat(envelope);

        byte[] sealed = new byte[envelope.getCiphertext().length + TAG_LENGTH];
        System.arraycopy(envelope.getCiphertext(), 0, sealed, 0, envelope.getCiphertext().length);
        System.arraycopy(envelope.getTag(), 0, sealed, envelope.getCiphertext().length, TAG_LENGTH);

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, envelope.getNonce()));
            plaintext = cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            log.warn("Envelope tag verification failed (key version {})", envelope.getKeyVersion());
            throw new EnvelopeAuthenticationException("Envelope authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Decryption failed", e);
        }

        String actual = checksum(plaintext);
        if (!MessageDigest.isEqual(actual.getBytes(StandardCharsets.US_ASCII),
                envelope.getChecksum().getBytes(StandardCharsets.US_ASCII))) {
            Arrays.fill(plaintext, (byte) 0);
            log.warn("Envelope checksum mismatch after successful decryption (key version {})",
                    envelope.getKeyVersion());
            throw new IntegrityException("Snapshot checksum does not match decrypted content");
        }
        return plaintext;
    }

    @Override
    public String checksum(byte[] plaintext) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(plaintext));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private void validateFormat(Envelope envelope) {
        if (envelope == null) {
            throw new EnvelopeFormatException("Envelope is required");
        }
        if (envelope.getNonce() == null || envelope.getNonce().length != NONCE_LENGTH) {
            throw new EnvelopeFormatException("Envelope nonce must be " + NONCE_LENGTH + " bytes");
        }
        if (envelope.getTag() == null || envelope.getTag().length != TAG_LENGTH) {
            throw new EnvelopeFormatException("Envelope tag must be " + TAG_LENGTH + " bytes");
        }
        if (envelope.getCiphertext() == null) {
            throw new EnvelopeFormatException("Envelope ciphertext is missing");
        }
        if (envelope.getChecksum() == null || !CHECKSUM_PATTERN.matcher(envelope.getChecksum()).matches()) {
            throw new EnvelopeFormatException("Envelope checksum must be 64 lowercase hex characters");
        }
    }

    private void requireKey(byte[] key) {
        if (key == null || key.length != KeyDerivationService.KEY_LENGTH) {
            throw new IllegalArgumentException("Key must be " + KeyDerivationService.KEY_LENGTH + " bytes");
        }
    }
}
