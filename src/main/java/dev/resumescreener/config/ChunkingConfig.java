package dev.resumescreener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Word-window sizes for resume chunking.
 * Loaded from application.yml under 'chunking' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "chunking")
public class ChunkingConfig {

    private int chunkWords = 250;
    private int overlapWords = 50;
}
