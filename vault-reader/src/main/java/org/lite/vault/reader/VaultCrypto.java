package org.lite.vault.reader;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of the vault file.
 *
 * File layout: IV (12 bytes) || ciphertext || tag (16 bytes). The key of each environment
 * is HKDF-SHA256 of the Base64-decoded vault master key with info {@code BIA-VAULT-{environment}}.
 */
public final class VaultCrypto {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final int HASH_LENGTH = 32;
    private static final String INFO_PREFIX = "BIA-VAULT-";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private VaultCrypto() {
    }

    public static byte[] encrypt(String plaintext, String masterKeyBase64, String environment)
            throws GeneralSecurityException {
        byte[] envKey = deriveEnvironmentKey(masterKeyBase64, environment);
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(envKey, "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + sealed.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(sealed, 0, combined, iv.length, sealed.length);
            return combined;
        } finally {
            Arrays.fill(envKey, (byte) 0);
        }
    }

    public static String decrypt(byte[] encryptedBytes, String masterKeyBase64, String environment)
            throws GeneralSecurityException {
        if (encryptedBytes.length <= GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new IllegalArgumentException("Vault file is truncated");
        }
        byte[] iv = Arrays.copyOfRange(encryptedBytes, 0, GCM_IV_LENGTH);
        byte[] sealed = Arrays.copyOfRange(encryptedBytes, GCM_IV_LENGTH, encryptedBytes.length);

        byte[] envKey = deriveEnvironmentKey(masterKeyBase64, environment);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(envKey, "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } finally {
            Arrays.fill(envKey, (byte) 0);
        }
    }

    /**
     * Random 32-byte value, Base64 encoded. Used both for vault master keys and snapshot master secrets.
     */
    public static String generateSecret() {
        byte[] secret = new byte[KEY_LENGTH];
        SECURE_RANDOM.nextBytes(secret);
        try {
            return Base64.getEncoder().encodeToString(secret);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    static byte[] deriveEnvironmentKey(String masterKeyBase64, String environment) throws GeneralSecurityException {
        byte[] masterKey;
        try {
            masterKey = Base64.getDecoder().decode(masterKeyBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Master key is not valid Base64", e);
        }
        try {
            return hkdfSha256(masterKey, (INFO_PREFIX + environment).getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
        } finally {
            Arrays.fill(masterKey, (byte) 0);
        }
    }

    /**
     * RFC 5869 extract-and-expand with an all-zero salt
     */
    static byte[] hkdfSha256(byte[] ikm, byte[] info, int length) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(new byte[HASH_LENGTH], HMAC_ALGORITHM));
        byte[] prk = mac.doFinal(ikm);
        try {
            mac.init(new SecretKeySpec(prk, HMAC_ALGORITHM));
            ByteArrayOutputStream okm = new ByteArrayOutputStream(length + HASH_LENGTH);
            byte[] block = new byte[0];
            for (int counter = 1; okm.size() < length; counter++) {
                mac.update(block);
                mac.update(info);
                mac.update((byte) counter);
                block = mac.doFinal();
                okm.write(block, 0, block.length);
            }
            return Arrays.copyOf(okm.toByteArray(), length);
        } finally {
            Arrays.fill(prk, (byte) 0);
        }
    }
}
