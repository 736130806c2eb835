package org.lite.snapshot.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.entity.BiaSnapshot;

/**
 * Turns payload documents into envelopes and stored snapshots back into documents.
 * Owns the DEK lifecycle: keys are derived per call and cleared before returning.
 */
public interface SnapshotPayloadCodec {

    /**
     * Canonical UTF-8 JSON bytes of the document
     */
    byte[] serialize(JsonNode payload);

    /**
     * Encrypt serialized payload bytes under the tenant's DEK for {@code keyVersion}
     *
     * @return envelope stamped with {@code keyVersion}
     */
    Envelope seal(String tenantId, int keyVersion, byte[] plaintext);

    /**
     * Derive the snapshot's DEK, decrypt, verify and parse the payload
     */
    JsonNode open(BiaSnapshot snapshot);
}
