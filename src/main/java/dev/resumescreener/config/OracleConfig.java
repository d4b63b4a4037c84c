package dev.resumescreener.config;

import dev.resumescreener.ai.PromptType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Call policy for the text-understanding oracle.
 * Provider credentials live under 'oracle.gemini' / 'oracle.openrouter'.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class OracleConfig {

    private String provider = "gemini";
    private Duration timeout = Duration.ofSeconds(60);
    /** Timeout for the single retry after a timed-out call. */
    private Duration timeoutRetry = Duration.ofSeconds(120);
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
    private Map<PromptType, Integer> maxOutputTokens = new EnumMap<>(PromptType.class);
    private Cache cache = new Cache();

    public int maxOutputTokensFor(PromptType type) {
        Integer configured = maxOutputTokens.get(type);
        return configured != null && configured > 0 ? configured : type.getDefaultMaxOutputTokens();
    }

    @Data
    public static class Cache {
        private long maxEntries = 10_000;
        private Duration ttl = Duration.ofHours(24);
    }
}
