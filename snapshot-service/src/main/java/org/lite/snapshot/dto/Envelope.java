package org.lite.snapshot.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Output of one AES-256-GCM encryption: nonce, ciphertext, tag, the key version
 * the DEK was derived for, and the SHA-256 checksum of the plaintext.
 */
@Value
@Builder(toBuilder = true)
public class Envelope {

    public static final String ALGORITHM = "AES-256-GCM";

    byte[] nonce;
    byte[] ciphertext;
    byte[] tag;
    int keyVersion;
    String checksum;

    public Envelope withKeyVersion(int keyVersion) {
        return toBuilder().keyVersion(keyVersion).build();
    }
}
