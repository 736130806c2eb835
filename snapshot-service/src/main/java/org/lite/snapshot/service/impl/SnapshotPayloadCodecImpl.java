package org.lite.snapshot.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.Envelope;
import org.lite.snapshot.entity.BiaSnapshot;
import org.lite.snapshot.exception.EnvelopeFormatException;
import org.lite.snapshot.exception.IntegrityException;
import org.lite.snapshot.exception.ValidationException;
import org.lite.snapshot.service.EnvelopeCipherService;
import org.lite.snapshot.service.KeyDerivationService;
import org.lite.snapshot.service.SnapshotPayloadCodec;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Arrays;

@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotPayloadCodecImpl implements SnapshotPayloadCodec {

    private final KeyDerivationService keyDerivationService;
    private final EnvelopeCipherService envelopeCipherService;
    private final ObjectMapper objectMapper;

    @Override
    public byte[] serialize(JsonNode payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Payload is not serializable", e);
        }
    }

    @Override
    public Envelope seal(String tenantId, int keyVersion, byte[] plaintext) {
        byte[] dek = keyDerivationService.deriveKey(tenantId, keyVersion);
        try {
            return envelopeCipherService.encrypt(plaintext, dek).withKeyVersion(keyVersion);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    @Override
    public JsonNode open(BiaSnapshot snapshot) {
        Envelope envelope;
        try {
            envelope = snapshot.toEnvelope();
        } catch (IllegalArgumentException e) {
            throw new EnvelopeFormatException("Stored envelope of version " + snapshot.getVersion()
                    + " is not valid Base64");
        }
        byte[] dek = keyDerivationService.deriveKey(snapshot.getTenantId(), envelope.getKeyVersion());
        byte[] plaintext = null;
        try {
            plaintext = envelopeCipherService.decrypt(envelope, dek);
            return objectMapper.readTree(plaintext);
        } catch (IOException e) {
            throw new IntegrityException("Decrypted snapshot version " + snapshot.getVersion()
                    + " is not a readable document", e);
        } finally {
            Arrays.fill(dek, (byte) 0);
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }
}
