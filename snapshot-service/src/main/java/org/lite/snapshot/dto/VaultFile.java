package org.lite.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decrypted content of the vault file: secrets grouped per environment.
 * Written by the vault-reader CLI, read-only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VaultFile {

    private String version;
    private Map<String, EnvironmentSecrets> environments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EnvironmentSecrets {
        private Instant updatedAt;
        private String updatedBy;
        private Map<String, String> secrets;
    }

    public Optional<String> findSecret(String environment, String key) {
        if (environments == null) {
            return Optional.empty();
        }
        EnvironmentSecrets envSecrets = environments.get(environment);
        if (envSecrets == null || envSecrets.getSecrets() == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(envSecrets.getSecrets().get(key));
    }

    public static VaultFile createEmpty() {
        return VaultFile.builder()
                .version("1.0")
                .environments(new HashMap<>())
                .build();
    }
}
