package dev.resumescreener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Resume ingestion settings.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ingestion")
public class IngestionConfig {

    /** Most prominent skills per resume that get an experience breakdown. */
    private int topSkills = 40;
    private int skillBatchSize = 10;
    private int concurrency = 4;
}
