package org.lite.snapshot.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.exception.ConfigurationException;
import org.lite.snapshot.service.VaultEncryptionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM decryption of the vault file. The key of each environment is
 * HKDF-SHA256(vault master key, info = "BIA-VAULT-{environment}").
 */
@Service
@Slf4j
public class VaultEncryptionServiceImpl implements VaultEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final String INFO_PREFIX = "BIA-VAULT-";

    private final String masterKeyBase64;

    public VaultEncryptionServiceImpl(@Value("${vault.master.key:}") String masterKeyBase64) {
        this.masterKeyBase64 = masterKeyBase64;
    }

    @Override
    public String decrypt(byte[] encryptedBytes, String environment) {
        if (encryptedBytes == null || encryptedBytes.length <= GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new ConfigurationException("Vault file is truncated");
        }
        byte[] iv = Arrays.copyOfRange(encryptedBytes, 0, GCM_IV_LENGTH);
        byte[] sealed = Arrays.copyOfRange(encryptedBytes, GCM_IV_LENGTH, encryptedBytes.length);

        byte[] envKey = deriveEnvironmentKey(environment);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(envKey, "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            log.error("Failed to decrypt vault file for environment {}: {}", environment, e.getClass().getSimpleName());
            throw new ConfigurationException("Vault file could not be decrypted for environment " + environment, e);
        } finally {
            Arrays.fill(envKey, (byte) 0);
        }
    }

    private byte[] deriveEnvironmentKey(String environment) {
        if (masterKeyBase64 == null || masterKeyBase64.isBlank()) {
            throw new ConfigurationException("vault.master.key is not set");
        }
        byte[] masterKey;
        try {
            masterKey = Base64.getDecoder().decode(masterKeyBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("vault.master.key is not valid Base64", e);
        }
        try {
            return HkdfKeyDerivationServiceImpl.hkdfSha256(masterKey,
                    (INFO_PREFIX + environment).getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
        } finally {
            Arrays.fill(masterKey, (byte) 0);
        }
    }
}
