package org.lite.snapshot.model;

import org.lite.snapshot.exception.ConfigurationException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Process-wide master secret, the input keying material for every tenant DEK.
 * Loaded once at startup and never printed.
 */
public final class MasterSecret {

    private final byte[] material;

    private MasterSecret(byte[] material) {
        this.material = material;
    }

    public static MasterSecret of(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("Master secret is missing or empty");
        }
        return new MasterSecret(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return a copy of the secret bytes; callers clear it when done
     */
    public byte[] copyMaterial() {
        return Arrays.copyOf(material, material.length);
    }

    @Override
    public String toString() {
        return "MasterSecret[redacted]";
    }
}
