package org.lite.vault.reader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.AEADBadTagException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VaultReaderCliTest {

    @TempDir
    Path tempDir;

    private Path vaultFile;
    private String masterKey;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        vaultFile = tempDir.resolve("vault.encrypted");
        masterKey = VaultCrypto.generateSecret();
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) throws Exception {
        out.reset();
        err.reset();
        return VaultReaderCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void testCreateWriteRead_RoundTrip() throws Exception {
        // Given
        assertEquals(0, run("--operation", "create", "--file", vaultFile.toString(),
                "--master-key", masterKey, "--environment", "dev"));
        assertEquals(0, run("--operation", "write", "--file", vaultFile.toString(),
                "--master-key", masterKey, "--environment", "dev", "--key", "mongodb.uri", "--value", "mongodb://db"));

        // When
        int exitCode = run("--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--key", "mongodb.uri");

        // Then
        assertEquals(0, exitCode);
        assertEquals("mongodb://db", stdout());
        assertFalse(Files.exists(tempDir.resolve("vault.encrypted.tmp")));
        assertTrue(Files.exists(tempDir.resolve("vault.encrypted.backup")));
    }

    @Test
    void testRead_EnvFormatMapsKnownKeys() throws Exception {
        // Given
        run("--operation", "write", "--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--key", VaultReaderCli.MASTER_SECRET_KEY, "--value", "c2VjcmV0");
        run("--operation", "write", "--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--key", "custom.api-token", "--value", "it's");

        // When
        int exitCode = run("--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--format", "env");

        // Then
        assertEquals(0, exitCode);
        String output = stdout();
        assertTrue(output.contains("export BIA_MASTER_SECRET='c2VjcmV0'"));
        assertTrue(output.contains("export CUSTOM_API_TOKEN='it'\"'\"'s'"));
    }

    @Test
    void testRead_EnvFileFormat() throws Exception {
        // Given
        run("--operation", "write", "--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "prod", "--key", "redis.password", "--value", "pw");

        // When
        int exitCode = run("--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "prod", "--format", "env-file");

        // Then
        assertEquals(0, exitCode);
        assertEquals("REDIS_PASSWORD=pw", stdout());
    }

    @Test
    void testRead_JsonFormat() throws Exception {
        // Given
        run("--operation", "write", "--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--key", "a", "--value", "1");

        // When
        int exitCode = run("--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--format", "json");

        // Then
        assertEquals(0, exitCode);
        assertTrue(stdout().contains("\"a\" : \"1\""));
    }

    @Test
    void testRead_WrongEnvironmentFailsAuthentication() throws Exception {
        // Given
        run("--operation", "write", "--file", vaultFile.toString(), "--master-key", masterKey,
                "--environment", "dev", "--key", "a", "--value", "1");

        // When / Then
        assertThrows(AEADBadTagException.class, () -> run("--file", vaultFile.toString(),
                "--master-key", masterKey, "--environment", "prod"));
    }

    @Test
    void testRead_WrongMasterKeyFailsAuthentication() throws Exception {
        // Given
        run("--operation", "create", "--file", vaultFile.toString(), "--master-key", masterKey);

        // When / Then
        assertThrows(AEADBadTagException.class, () -> run("--file", vaultFile.toString(),
                "--master-key", VaultCrypto.generateSecret()));
    }

    @Test
    void testRead_MissingKeyReturnsError() throws Exception {
        // Given
        run("--operation", "create", "--file", vaultFile.toString(), "--master-key", masterKey);

        // When
        int exitCode = run("--file", vaultFile.toString(), "--master-key", masterKey, "--key", "absent");

        // Then
        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("secret not found: absent"));
    }

    @Test
    void testRun_MissingArgumentsPrintsUsage() throws Exception {
        // When
        int exitCode = run("--environment", "dev");

        // Then
        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void testWrite_WithoutValueFails() throws Exception {
        // When
        int exitCode = run("--operation", "write", "--file", vaultFile.toString(),
                "--master-key", masterKey, "--key", "a");

        // Then
        assertEquals(1, exitCode);
        assertFalse(Files.exists(vaultFile));
    }

    @Test
    void testGenerateMasterSecret_PrintsRandom32Bytes() throws Exception {
        // When
        int exitCode = run("--operation", "generate-master-secret");

        // Then
        assertEquals(0, exitCode);
        assertEquals(32, Base64.getDecoder().decode(stdout()).length);
    }

    @Test
    void testGenerateMasterSecret_StoresInVault() throws Exception {
        // When
        int exitCode = run("--operation", "generate-master-secret", "--file", vaultFile.toString(),
                "--master-key", masterKey, "--environment", "staging");

        // Then
        assertEquals(0, exitCode);
        run("--file", vaultFile.toString(), "--master-key", masterKey, "--environment", "staging",
                "--key", VaultReaderCli.MASTER_SECRET_KEY);
        assertEquals(32, Base64.getDecoder().decode(stdout()).length);
    }

    @Test
    void testVaultFile_LayoutIsIvCiphertextTag() throws Exception {
        // Given
        String json = "{\"version\":\"1.0\"}";

        // When
        byte[] encrypted = VaultCrypto.encrypt(json, masterKey, "dev");

        // Then
        assertEquals(12 + json.length() + 16, encrypted.length);
        assertEquals(json, VaultCrypto.decrypt(encrypted, masterKey, "dev"));
    }

    @Test
    void testDecrypt_TruncatedFileRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> VaultCrypto.decrypt(new byte[20], masterKey, "dev"));
    }

    @Test
    void testHkdfSha256_MatchesRfc5869TestCase3() throws Exception {
        // Given
        byte[] ikm = new byte[22];
        Arrays.fill(ikm, (byte) 0x0b);

        // When
        byte[] okm = VaultCrypto.hkdfSha256(ikm, new byte[0], 42);

        // Then
        assertEquals("8da4e775a563c18f715f802a063c5a31b8a11f5c5ee1879ec3454e5f3c738d2d"
                + "9d201395faa4b61a96c8", HexFormat.of().formatHex(okm));
    }

    @Test
    void testDeriveEnvironmentKey_DiffersPerEnvironment() throws Exception {
        assertFalse(Arrays.equals(VaultCrypto.deriveEnvironmentKey(masterKey, "dev"),
                VaultCrypto.deriveEnvironmentKey(masterKey, "prod")));
    }

    @Test
    void testToEnvName_FallsBackToUpperSnakeCase() {
        assertEquals("MONGODB_URI", VaultReaderCli.toEnvName("mongodb.uri"));
        assertEquals("SOME_NESTED_KEY", VaultReaderCli.toEnvName("some.nested-key"));
    }

    @Test
    void testParseArgs_FlagWithoutValue() {
        Map<String, String> options = VaultReaderCli.parseArgs(new String[]{"--verbose", "--file", "f"});
        assertEquals("true", options.get("verbose"));
        assertEquals("f", options.get("file"));
    }
}
