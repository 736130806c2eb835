package org.lite.snapshot.exception;

import org.lite.snapshot.dto.ErrorCode;

/**
 * Cache backend failure. Only ever logged; the cache degrades to misses.
 */
public class CacheException extends SnapshotVaultException {

    public CacheException(String message, Throwable cause) {
        super(ErrorCode.CACHE_ERROR, message, cause);
    }
}
