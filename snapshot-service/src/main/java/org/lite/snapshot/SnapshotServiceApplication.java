package org.lite.snapshot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

@SpringBootApplication
@EnableScheduling
public class SnapshotServiceApplication {

    // Read from .env so ${...} placeholders in application.yml resolve when running from an IDE
    private static final List<String> ENV_FILE_KEYS = List.of("VAULT_MASTER_KEY", "BIA_MASTER_SECRET");

    public static void main(String[] args) {
        loadSecretsFromEnvFile(Path.of(System.getProperty("user.dir"), ".env"));
        SpringApplication.run(SnapshotServiceApplication.class, args);
    }

    /**
     * Copies the known keys from a .env file into system properties unless they are already set
     */
    static void loadSecretsFromEnvFile(Path envFile) {
        if (!Files.isRegularFile(envFile)) {
            return;
        }
        try (Stream<String> lines = Files.lines(envFile)) {
            lines.map(String::trim)
                    .filter(line -> !line.startsWith("#") && line.contains("="))
                    .forEach(line -> {
                        String key = line.substring(0, line.indexOf('=')).trim();
                        String value = line.substring(line.indexOf('=') + 1).trim();
                        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                            value = value.substring(1, value.length() - 1);
                        }
                        if (ENV_FILE_KEYS.contains(key) && !value.isEmpty()
                                && System.getProperty(key) == null && System.getenv(key) == null) {
                            System.setProperty(key, value);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + envFile, e);
        }
    }
}
