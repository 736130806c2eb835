package org.lite.vault.reader;

import org.lite.vault.reader.dto.VaultFile;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Standalone CLI for the encrypted vault used by the snapshot service.
 * Usage: java -jar vault-reader.jar --file /path/to/vault.encrypted
 * --master-key <base64-key> --environment dev --format env
 */
public class VaultReaderCli {

    static final String MASTER_SECRET_KEY = "bia.encryption.master.key";

    private static final Map<String, String> ENV_NAMES = Map.of(
            MASTER_SECRET_KEY, "BIA_MASTER_SECRET",
            "mongodb.uri", "MONGODB_URI",
            "redis.password", "REDIS_PASSWORD");

    public static void main(String[] args) {
        try {
            int exitCode = run(args, System.out, System.err);
            if (exitCode != 0) {
                System.exit(exitCode);
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Runs one CLI operation and returns the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException, GeneralSecurityException {
        Map<String, String> options = parseArgs(args);
        String operation = options.getOrDefault("operation", "read");

        if ("generate-master-secret".equals(operation)) {
            return generateMasterSecret(options, out);
        }

        String vaultFile = options.get("file");
        String masterKey = options.get("master-key");
        if (vaultFile == null || masterKey == null) {
            printUsage(err);
            return 1;
        }
        String environment = options.getOrDefault("environment", "dev");
        VaultFileStore store = new VaultFileStore(Paths.get(vaultFile), masterKey);

        switch (operation) {
            case "create":
                createEmptyVault(store, environment);
                out.println("Empty vault created successfully: " + vaultFile);
                return 0;
            case "write": {
                String key = options.get("key");
                String value = options.get("value");
                if (key == null || value == null) {
                    err.println("Error: --key and --value are required for write operation");
                    return 1;
                }
                writeSecret(store, environment, key, value);
                out.println("Secret written successfully: " + key);
                return 0;
            }
            case "read":
                return readSecrets(store, environment, options, out, err);
            default:
                err.println("Error: unknown operation '" + operation + "'");
                printUsage(err);
                return 1;
        }
    }

    private static int readSecrets(VaultFileStore store, String environment, Map<String, String> options,
                                   PrintStream out, PrintStream err) throws IOException, GeneralSecurityException {
        VaultFile vault = store.load(environment);
        Map<String, String> secrets = vault.secretsOf(environment);
        if (secrets.isEmpty()) {
            err.println("Warning: no secrets found for environment " + environment);
        }

        String key = options.get("key");
        if (key != null) {
            String value = secrets.get(key);
            if (value == null) {
                err.println("Error: secret not found: " + key);
                return 1;
            }
            out.println(value);
            return 0;
        }

        String format = options.getOrDefault("format", "env");
        Map<String, String> sorted = new TreeMap<>(secrets);
        switch (format) {
            case "json":
                out.println(store.toJson(sorted));
                return 0;
            case "env":
                sorted.forEach((name, value) -> out.println("export " + toEnvName(name) + "=" + shellQuote(value)));
                return 0;
            case "env-file":
                sorted.forEach((name, value) -> out.println(toEnvName(name) + "=" + value));
                return 0;
            default:
                err.println("Error: unknown format '" + format + "' (expected env, env-file or json)");
                return 1;
        }
    }

    private static int generateMasterSecret(Map<String, String> options, PrintStream out)
            throws IOException, GeneralSecurityException {
        String secret = VaultCrypto.generateSecret();
        String vaultFile = options.get("file");
        String masterKey = options.get("master-key");
        if (vaultFile != null && masterKey != null) {
            String environment = options.getOrDefault("environment", "dev");
            VaultFileStore store = new VaultFileStore(Paths.get(vaultFile), masterKey);
            if (!store.exists()) {
                createEmptyVault(store, environment);
            }
            writeSecret(store, environment, MASTER_SECRET_KEY, secret);
            out.println("Master secret stored as " + MASTER_SECRET_KEY + " for environment " + environment);
            return 0;
        }
        out.println(secret);
        return 0;
    }

    static void createEmptyVault(VaultFileStore store, String environment) throws IOException, GeneralSecurityException {
        store.save(VaultFile.createEmpty(), environment);
    }

    static void writeSecret(VaultFileStore store, String environment, String key, String value)
            throws IOException, GeneralSecurityException {
        VaultFile vault = store.exists() ? store.load(environment) : VaultFile.createEmpty();
        vault.putSecret(environment, key, value, System.getProperty("user.name", "cli"), Instant.now());
        store.save(vault, environment);
    }

    static String toEnvName(String key) {
        String mapped = ENV_NAMES.get(key);
        if (mapped != null) {
            return mapped;
        }
        return key.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    private static String shellQuote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--")) {
                String name = args[i].substring(2);
                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    options.put(name, args[++i]);
                } else {
                    options.put(name, "true");
                }
            }
        }
        return options;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  Read secrets:");
        err.println("    VaultReaderCli --file <vault-file> --master-key <base64-key> [--environment <env>]"
                + " [--format <env|env-file|json>] [--key <secret-key>]");
        err.println("  Write secret:");
        err.println("    VaultReaderCli --operation write --file <vault-file> --master-key <base64-key>"
                + " --environment <env> --key <secret-key> --value <secret-value>");
        err.println("  Create empty vault:");
        err.println("    VaultReaderCli --operation create --file <vault-file> --master-key <base64-key>"
                + " [--environment <env>]");
        err.println("  Generate master secret:");
        err.println("    VaultReaderCli --operation generate-master-secret"
                + " [--file <vault-file> --master-key <base64-key> --environment <env>]");
    }
}
