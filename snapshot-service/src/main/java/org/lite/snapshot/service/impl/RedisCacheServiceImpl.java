package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.exception.CacheException;
import org.lite.snapshot.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Service
@Slf4j
@Profile("!in-memory")
@RequiredArgsConstructor
public class RedisCacheServiceImpl implements CacheService {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final SnapshotProperties properties;

    @Override
    public Mono<String> get(String key) {
        log.debug("Redis Get: {}", key);
        return redisTemplate.opsForValue().get(key)
                .timeout(timeout())
                .onErrorMap(e -> new CacheException("Redis Get failed for " + key, e));
    }

    @Override
    public Mono<Void> set(String key, String value, Duration duration) {
        log.debug("Redis Set: {}", key);
        return redisTemplate.opsForValue().set(key, value, duration)
                .timeout(timeout())
                .onErrorMap(e -> new CacheException("Redis Set failed for " + key, e))
                .then();
    }

    @Override
    public Mono<Long> deleteMatching(String pattern) {
        log.debug("Redis DeleteMatching: {}", pattern);
        // SCAN instead of KEYS so large keyspaces do not block the server
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(500).build())
                .buffer(500)
                .concatMap(keys -> redisTemplate.delete(keys.toArray(new String[0])))
                .reduce(0L, Long::sum)
                .timeout(timeout())
                .onErrorMap(e -> new CacheException("Redis DeleteMatching failed for " + pattern, e));
    }

    private Duration timeout() {
        return properties.getCache().getOperationTimeout();
    }
}
