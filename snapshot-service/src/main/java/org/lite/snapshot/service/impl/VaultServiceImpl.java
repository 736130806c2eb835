package org.lite.snapshot.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.service.VaultFileService;
import org.lite.snapshot.service.VaultService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
public class VaultServiceImpl implements VaultService {

    private final VaultFileService vaultFileService;
    private final String environment;

    public VaultServiceImpl(VaultFileService vaultFileService,
                            @Value("${vault.environment:dev}") String environment) {
        this.vaultFileService = vaultFileService;
        this.environment = environment;
    }

    @Override
    public Optional<String> findSecret(String key) {
        Optional<String> value = vaultFileService.loadVault().findSecret(environment, key);
        log.debug("Vault lookup: {} in environment {} ({})", key, environment, value.isPresent() ? "found" : "absent");
        return value;
    }

    @Override
    public String getEnvironment() {
        return environment;
    }
}
