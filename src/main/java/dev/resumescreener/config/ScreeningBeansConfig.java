package dev.resumescreener.config;

import dev.resumescreener.ai.CaffeineOracleResponseCache;
import dev.resumescreener.ai.OracleResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans: the ingestion clock and the oracle response cache.
 */
@Slf4j
@Configuration
public class ScreeningBeansConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public OracleResponseCache oracleResponseCache(OracleConfig oracleConfig) {
        OracleConfig.Cache cache = oracleConfig.getCache();
        log.info("Oracle response cache: max {} entries, ttl {}", cache.getMaxEntries(), cache.getTtl());
        return new CaffeineOracleResponseCache(cache.getMaxEntries(), cache.getTtl());
    }
}
