package dev.resumescreener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Hybrid evidence retrieval settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalConfig {

    private int topK = 10;
    private double keywordBoost = 1.5;
    private String queryTemplate = "Experience with %s skill";
}
