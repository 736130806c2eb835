package org.lite.snapshot.config;

import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.model.MasterSecret;
import org.lite.snapshot.service.VaultService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the master secret once at startup. A missing secret fails the context.
 */
@Configuration
@Slf4j
public class MasterSecretConfig {

    @Bean
    public MasterSecret masterSecret(VaultService vaultService, SnapshotProperties properties) {
        String secret = vaultService.findSecret(properties.getMasterSecretKey()).orElse(null);
        if (secret != null) {
            log.info("Master secret loaded from vault ({}, environment {})",
                    properties.getMasterSecretKey(), vaultService.getEnvironment());
        } else {
            log.warn("Vault has no {} for environment {}, falling back to bia.snapshot.master-secret",
                    properties.getMasterSecretKey(), vaultService.getEnvironment());
            secret = properties.getMasterSecret();
        }
        return MasterSecret.of(secret);
    }
}
