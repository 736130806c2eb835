package org.lite.snapshot.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.VaultFile;
import org.lite.snapshot.exception.ConfigurationException;
import org.lite.snapshot.service.VaultEncryptionService;
import org.lite.snapshot.service.VaultFileService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
@Slf4j
public class VaultFileServiceImpl implements VaultFileService {

    private final VaultEncryptionService encryptionService;
    private final ObjectMapper objectMapper;
    private final Path vaultFilePath;
    private final String environment;

    public VaultFileServiceImpl(VaultEncryptionService encryptionService,
                                ObjectMapper objectMapper,
                                @Value("${vault.file.path:./secrets/vault.encrypted}") String vaultFilePath,
                                @Value("${vault.environment:dev}") String environment) {
        this.encryptionService = encryptionService;
        this.objectMapper = objectMapper;
        this.vaultFilePath = Path.of(vaultFilePath).toAbsolutePath();
        this.environment = environment;
    }

    @Override
    public VaultFile loadVault() {
        if (!Files.exists(vaultFilePath)) {
            log.warn("Vault file not found: {}. Using an empty vault.", vaultFilePath);
            return VaultFile.createEmpty();
        }
        try {
            byte[] encryptedBytes = Files.readAllBytes(vaultFilePath);
            if (encryptedBytes.length == 0) {
                log.warn("Vault file is empty: {}. Using an empty vault.", vaultFilePath);
                return VaultFile.createEmpty();
            }
            String json = encryptionService.decrypt(encryptedBytes, environment);
            VaultFile vault = objectMapper.readValue(json, VaultFile.class);
            log.info("Vault file loaded from: {}", vaultFilePath);
            return vault;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read vault file " + vaultFilePath, e);
        }
    }
}
