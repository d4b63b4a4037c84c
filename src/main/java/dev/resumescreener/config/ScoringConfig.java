package dev.resumescreener.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring request settings. Score weights are fixed in
 * {@link dev.resumescreener.service.ScoreAggregationService} and are not configurable.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private int concurrency = 4;
    /** Whether nice-to-have skills are evaluated and reported. They never count toward the core score. */
    private boolean evaluateNiceToHave = true;
}
