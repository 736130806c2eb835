package org.lite.snapshot.service;

import java.util.Optional;

/**
 * Read access to vault secrets of the current environment
 */
public interface VaultService {

    Optional<String> findSecret(String key);

    String getEnvironment();
}
