package org.lite.vault.reader.dto;

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
 * Decrypted vault content: secrets grouped per environment.
 * Same JSON layout the snapshot-service reads at startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VaultFile {

    public static final String FORMAT_VERSION = "1.0";

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

    public static VaultFile createEmpty() {
        return VaultFile.builder()
                .version(FORMAT_VERSION)
                .environments(new HashMap<>())
                .build();
    }

    public Optional<String> findSecret(String environment, String key) {
        return Optional.ofNullable(secretsOf(environment).get(key));
    }

    /**
     * Secrets of one environment, empty when the environment has none
     */
    public Map<String, String> secretsOf(String environment) {
        if (environments == null) {
            return Map.of();
        }
        EnvironmentSecrets envSecrets = environments.get(environment);
        if (envSecrets == null || envSecrets.getSecrets() == null) {
            return Map.of();
        }
        return envSecrets.getSecrets();
    }

    public void putSecret(String environment, String key, String value, String updatedBy, Instant updatedAt) {
        if (environments == null) {
            environments = new HashMap<>();
        }
        EnvironmentSecrets envSecrets = environments.computeIfAbsent(environment,
                env -> EnvironmentSecrets.builder().secrets(new HashMap<>()).build());
        if (envSecrets.getSecrets() == null) {
            envSecrets.setSecrets(new HashMap<>());
        }
        envSecrets.getSecrets().put(key, value);
        envSecrets.setUpdatedAt(updatedAt);
        envSecrets.setUpdatedBy(updatedBy);
    }
}
