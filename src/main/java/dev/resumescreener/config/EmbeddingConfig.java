package dev.resumescreener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Embedding provider settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingConfig {

    private String apiKey = "";
    private String model = "text-embedding-004";
    private String baseUrl = "https://generativelanguage.googleapis.com";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxInputChars = 8000;
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);
}
