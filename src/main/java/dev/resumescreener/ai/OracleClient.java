package dev.resumescreener.ai;

import dev.resumescreener.ai.dto.OracleResponse;
import dev.resumescreener.config.OracleConfig;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Structured gateway to the text oracle: cache lookup, call with timeout and retries,
 * JSON extraction, schema validation, cache store.
 *
 * <p>Parse and throttling failures are retried with exponential backoff; after a parse failure
 * the prompt is re-sent with a stricter preamble. A timeout gets exactly one retry with the
 * longer timeout and then surfaces as {@link OracleTimeoutException} so the caller can pick
 * its neutral fallback.
 */
@Slf4j
@Component
public class OracleClient {

    private final TextOracle oracle;
    private final OracleResponseParser parser;
    private final OracleResponseCache cache;
    private final OracleConfig config;
    private final ScreeningMetrics metrics;
    private final OracleRetryPolicy retryPolicy;

    public OracleClient(TextOracle oracle, OracleResponseParser parser, OracleResponseCache cache,
            OracleConfig config, ScreeningMetrics metrics) {
        this.oracle = oracle;
        this.parser = parser;
        this.cache = cache;
        this.config = config;
        this.metrics = metrics;
        this.retryPolicy = OracleRetryPolicy.forOracle(config.getMaxAttempts(), config.getInitialBackoff());
        log.info("Oracle client using provider '{}' (timeout {}, retry timeout {}, max attempts {})",
                oracle.getName(), config.getTimeout(), config.getTimeoutRetry(), config.getMaxAttempts());
    }

    /**
     * Call the oracle and bind its answer to {@code responseType}.
     *
     * @param type       prompt type, selects the output budget and namespaces the cache key
     * @param cacheInput the variable input the prompt was built from
     * @param prompt     full prompt text
     */
    public <T extends OracleResponse> Mono<T> call(PromptType type, String cacheInput, String prompt,
            Class<T> responseType) {
        String key = cacheKey(type, cacheInput);
        String label = type.name().toLowerCase(Locale.ROOT);

        return Mono.defer(() -> {
            Optional<T> cached = cache.get(key, responseType);
            if (cached.isPresent()) {
                log.debug("Oracle cache hit for {}", label);
                metrics.recordOracleCacheHit(label);
                return Mono.just(cached.get());
            }

            int maxTokens = config.maxOutputTokensFor(type);
            AtomicBoolean strict = new AtomicBoolean(false);
            long start = System.nanoTime();

            return attempt(label, prompt, maxTokens, responseType, strict, config.getTimeout())
                    .onErrorResume(OracleTimeoutException.class, e -> {
                        log.warn("Oracle {} call timed out after {}, retrying once with {}",
                                label, config.getTimeout(), config.getTimeoutRetry());
                        metrics.recordOracleRetry(label);
                        return attempt(label, prompt, maxTokens, responseType, strict, config.getTimeoutRetry());
                    })
                    .doOnNext(value -> cache.put(key, value))
                    .doOnError(e -> {
                        metrics.recordOracleError(label, e.getClass().getSimpleName());
                        log.warn("Oracle {} call failed: {}", label, e.getMessage());
                    })
                    .doFinally(signal -> metrics.getOracleTimer(label)
                            .record(Duration.ofNanos(System.nanoTime() - start)));
        });
    }

    private <T extends OracleResponse> Mono<T> attempt(String label, String prompt, int maxTokens,
            Class<T> responseType, AtomicBoolean strict, Duration timeout) {
        return Mono.defer(() -> {
                    metrics.recordOracleCall(label);
                    String effectivePrompt = strict.get() ? Prompts.strict(prompt) : prompt;
                    return oracle.invoke(effectivePrompt, maxTokens);
                })
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new OracleTimeoutException(timeout, e))
                .map(raw -> parser.parse(raw, responseType))
                .doOnError(OracleParseException.class, e -> {
                    log.debug("Unparsable {} answer, next attempt uses the strict prompt", label);
                    strict.set(true);
                })
                .retryWhen(retryPolicy.toRetry("oracle " + label)
                        .doAfterRetry(signal -> metrics.recordOracleRetry(label)));
    }

    static String cacheKey(PromptType type, String input) {
        String normalized = input == null ? "" : input.strip().replaceAll("\\s+", " ");
        return HashUtils.sha256Hex(type.name() + "\n" + normalized);
    }
}
