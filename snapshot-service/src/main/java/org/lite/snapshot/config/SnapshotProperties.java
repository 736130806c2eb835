package org.lite.snapshot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "bia.snapshot")
@Data
public class SnapshotProperties {

    /**
     * Vault key holding the master secret
     */
    private String masterSecretKey = "bia.encryption.master.key";

    /**
     * Used only when the vault has no entry for {@link #masterSecretKey}
     */
    private String masterSecret;

    private int defaultKeyVersion = 1;

    /**
     * How long a node keeps a tenant's current key version. After a rotation, other nodes keep
     * encrypting new snapshots under the previous version for at most this long.
     */
    private Duration keyVersionCacheTtl = Duration.ofSeconds(10);
    private long maxPayloadBytes = 1_048_576L; // 1 MiB
    private boolean auditReads = true;

    private Store store = new Store();
    private Audit audit = new Audit();
    private Cache cache = new Cache();

    @Data
    public static class Store {
        private int maxAppendAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(20);
        private Duration maxBackoff = Duration.ofMillis(500);
        private int maxStorageRetries = 2;
        private int maxPageSize = 100;
    }

    @Data
    public static class Audit {
        private int retentionDays = 365;
        private int defaultQueryDays = 90;
        private String archivalCron = "0 0 2 * * ?";
    }

    @Data
    public static class Cache {
        private Duration viewTtl = Duration.ofMinutes(30);
        private Duration operationTimeout = Duration.ofMillis(500);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(25);
        private int historyViewSize = 10;
    }
}
