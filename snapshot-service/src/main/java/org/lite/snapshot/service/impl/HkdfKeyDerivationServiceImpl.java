package org.lite.snapshot.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.model.MasterSecret;
import org.lite.snapshot.service.KeyDerivationService;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * HKDF (RFC 5869) over HMAC-SHA256.
 *
 * No salt is used; uniqueness of each DEK comes from the info string
 * {@code BIA-DEK-{tenantId}-{keyVersion}}.
 */
@Slf4j
@Service
public class HkdfKeyDerivationServiceImpl implements KeyDerivationService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int HASH_LENGTH = 32;
    private static final String INFO_PREFIX = "BIA-DEK-";

    private final MasterSecret masterSecret;

    public HkdfKeyDerivationServiceImpl(MasterSecret masterSecret) {
        this.masterSecret = masterSecret;
    }

    @Override
    public byte[] deriveKey(String tenantId, int keyVersion) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Tenant id is required for key derivation");
        }
        if (keyVersion < 1) {
            throw new ValidationException("Key version must be 1 or greater, got " + keyVersion);
        }

        byte[] ikm = masterSecret.copyMaterial();
        try {
            return hkdfSha256(ikm, info(tenantId, keyVersion), KEY_LENGTH);
        } finally {
            Arrays.fill(ikm, (byte) 0);
        }
    }

    static byte[] info(String tenantId, int keyVersion) {
        return (INFO_PREFIX + tenantId + "-" + keyVersion).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * HKDF extract-and-expand with an absent salt (a string of HashLen zeros).
     */
    public static byte[] hkdfSha256(byte[] ikm, byte[] info, int length) {
        if (length > 255 * HASH_LENGTH) {
            throw new IllegalArgumentException("HKDF output length too large: " + length);
        }
        byte[] prk = null;
        try {
            // Extract
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(new byte[HASH_LENGTH], HMAC_ALGORITHM));
            prk = mac.doFinal(ikm);

            // Expand
            mac.init(new SecretKeySpec(prk, HMAC_ALGORITHM));
            ByteArrayOutputStream okm = new ByteArrayOutputStream(length + HASH_LENGTH);
            byte[] previous = new byte[0];
            int counter = 1;
            while (okm.size() < length) {
                mac.update(previous);
                mac.update(info);
                mac.update((byte) counter++);
                previous = mac.doFinal();
                okm.write(previous, 0, previous.length);
            }
            byte[] all = okm.toByteArray();
            byte[] result = Arrays.copyOf(all, length);
            Arrays.fill(all, (byte) 0);
            Arrays.fill(previous, (byte) 0);
            return result;
        } catch (GeneralSecurityException e) {
            log.error("HKDF derivation failed: {}", e.getClass().getSimpleName());
            throw new IllegalStateException("HmacSHA256 is not available", e);
        } finally {
            if (prk != null) {
                Arrays.fill(prk, (byte) 0);
            }
        }
    }
}
