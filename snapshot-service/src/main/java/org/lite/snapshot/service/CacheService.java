package org.lite.snapshot.service;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value primitives of the view cache backend. Backend failures are signalled
 * as {@link org.lite.snapshot.exception.CacheException}; callers decide how to degrade.
 */
public interface CacheService {

    Mono<String> get(String key);

    Mono<Void> set(String key, String value, Duration duration);

    /**
     * Deletes every key matching the glob pattern
     *
     * @return number of keys removed
     */
    Mono<Long> deleteMatching(String pattern);
}
