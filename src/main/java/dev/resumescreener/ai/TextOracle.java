package dev.resumescreener.ai;

import reactor.core.publisher.Mono;

/**
 * A text-understanding model reached over HTTP.
 * Implementations return the raw completion text; parsing happens in {@link OracleClient}.
 */
public interface TextOracle {

    /**
     * Send one prompt.
     *
     * @param prompt          full prompt text
     * @param maxOutputTokens completion budget
     * @return Mono with the completion text, failing with {@link OracleThrottledException}
     *         on 429/5xx or {@link OracleParseException} on an empty answer
     */
    Mono<String> invoke(String prompt, int maxOutputTokens);

    /**
     * @return true if the provider is configured with credentials
     */
    boolean isEnabled();

    /**
     * @return provider name for logs and metrics
     */
    String getName();
}
