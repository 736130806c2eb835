package org.lite.snapshot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.enums.SnapshotSource;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Base64;

/**
 * One encrypted, immutable version of a tenant's BIA dataset.
 * Corrections and rollbacks are written as new versions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "bia_snapshots")
@CompoundIndexes({
    // Exactly one snapshot per (tenant, version); racing appends fail on this index
    @CompoundIndex(name = "tenant_version_uidx", def = "{'tenantId': 1, 'version': -1}", unique = true),
    @CompoundIndex(name = "tenant_key_version_idx", def = "{'tenantId': 1, 'keyVersion': 1, 'version': 1}")
})
public class BiaSnapshot {

    @Id
    private String id;

    private String tenantId;

    private Integer version;

    /**
     * Base64 ciphertext without the GCM tag
     */
    private String ciphertext;

    private String nonce;       // Base64, 12 bytes
    private String tag;         // Base64, 16 bytes
    private Integer keyVersion;
    private String checksum;    // hex SHA-256 of the plaintext

    @Builder.Default
    private String algorithm = Envelope.ALGORITHM;

    private String savedBy;
    private SnapshotSource source;
    private Instant createdAt;
    private Integer recordCount;
    private String notes;

    public Envelope toEnvelope() {
        Base64.Decoder decoder = Base64.getDecoder();
        return Envelope.builder()
                .nonce(nonce != null ? decoder.decode(nonce) : null)
                .ciphertext(ciphertext != null ? decoder.decode(ciphertext) : null)
                .tag(tag != null ? decoder.decode(tag) : null)
                .keyVersion(keyVersion != null ? keyVersion : 0)
                .checksum(checksum)
                .build();
    }

    public static BiaSnapshotBuilder fromEnvelope(Envelope envelope) {
        Base64.Encoder encoder = Base64.getEncoder();
        return BiaSnapshot.builder()
                .nonce(encoder.encodeToString(envelope.getNonce()))
                .ciphertext(encoder.encodeToString(envelope.getCiphertext()))
                .tag(encoder.encodeToString(envelope.getTag()))
                .keyVersion(envelope.getKeyVersion())
                .checksum(envelope.getChecksum());
    }
}
