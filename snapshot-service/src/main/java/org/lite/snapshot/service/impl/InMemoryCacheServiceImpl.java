package org.lite.snapshot.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@Slf4j
@Profile("in-memory")
@RequiredArgsConstructor
public class InMemoryCacheServiceImpl implements CacheService {

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final Clock clock;

    private record CacheEntry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> {
            CacheEntry entry = cache.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(Instant.now(clock))) {
                cache.remove(key, entry);
                return null;
            }
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration duration) {
        return Mono.fromRunnable(() -> cache.put(key, new CacheEntry(value, Instant.now(clock).plus(duration))));
    }

    @Override
    public Mono<Long> deleteMatching(String pattern) {
        return Mono.fromSupplier(() -> {
            Pattern regex = globToRegex(pattern);
            List<String> matching = cache.keySet().stream()
                    .filter(key -> regex.matcher(key).matches())
                    .collect(Collectors.toList());
            matching.forEach(cache::remove);
            log.debug("Removed {} in-memory cache entries matching {}", matching.size(), pattern);
            return (long) matching.size();
        });
    }

    // Convert glob pattern to regex, quoting everything else
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
