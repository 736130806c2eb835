package org.lite.vault.reader;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.lite.vault.reader.dto.VaultFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.util.EnumSet;

/**
 * Reads and writes the encrypted vault file for one environment
 */
public class VaultFileStore {

    private final Path vaultFile;
    private final String masterKeyBase64;
    private final ObjectMapper mapper;

    public VaultFileStore(Path vaultFile, String masterKeyBase64) {
        this.vaultFile = vaultFile;
        this.masterKeyBase64 = masterKeyBase64;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public boolean exists() {
        return Files.exists(vaultFile);
    }

    public VaultFile load(String environment) throws IOException, GeneralSecurityException {
        if (!Files.exists(vaultFile)) {
            throw new IOException("Vault file not found: " + vaultFile);
        }
        byte[] encryptedBytes = Files.readAllBytes(vaultFile);
        if (encryptedBytes.length == 0) {
            throw new IOException("Vault file is empty: " + vaultFile);
        }
        String json = VaultCrypto.decrypt(encryptedBytes, masterKeyBase64, environment);
        return mapper.readValue(json, VaultFile.class);
    }

    /**
     * Encrypts the vault for {@code environment} and replaces the file atomically,
     * keeping the previous file as {@code .backup}
     */
    public void save(VaultFile vault, String environment) throws IOException, GeneralSecurityException {
        byte[] encryptedBytes = VaultCrypto.encrypt(mapper.writeValueAsString(vault), masterKeyBase64, environment);

        Path parent = vaultFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.exists(vaultFile)) {
            Files.copy(vaultFile, vaultFile.resolveSibling(vaultFile.getFileName() + ".backup"),
                    StandardCopyOption.REPLACE_EXISTING);
        }

        Path tempFile = vaultFile.resolveSibling(vaultFile.getFileName() + ".tmp");
        Files.write(tempFile, encryptedBytes);
        Files.move(tempFile, vaultFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        try {
            Files.setPosixFilePermissions(vaultFile,
                    EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException e) {
            System.err.println("Warning: could not restrict permissions of " + vaultFile + " on this file system");
        }
    }

    public String toJson(Object value) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
