package org.lite.snapshot.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.codec.CodecCustomizer;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.codec.CodecConfigurer;

/**
 * Sizes the request decode buffer from {@code bia.snapshot.max-payload-bytes} so that every payload
 * the service accepts can be read. Ordered last so it wins over {@code spring.codec.max-in-memory-size}.
 */
@Configuration
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class CodecConfig implements CodecCustomizer {

    // room for source, notes and JSON framing around the payload document
    static final int REQUEST_OVERHEAD_BYTES = 64 * 1024;

    private final SnapshotProperties properties;

    @Override
    public void customize(CodecConfigurer configurer) {
        int limit = maxInMemorySize();
        log.debug("Request decode buffer limited to {} bytes", limit);
        configurer.defaultCodecs().maxInMemorySize(limit);
    }

    public int maxInMemorySize() {
        return (int) Math.min(Integer.MAX_VALUE, properties.getMaxPayloadBytes() + REQUEST_OVERHEAD_BYTES);
    }
}
