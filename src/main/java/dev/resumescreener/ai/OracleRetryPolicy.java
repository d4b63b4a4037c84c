package dev.resumescreener.ai;

import lombok.extern.slf4j.Slf4j;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded exponential-backoff policy applied at every external-collaborator boundary.
 * {@code maxAttempts} counts the first call, so 3 means the original call plus two retries.
 */
@Slf4j
public class OracleRetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Predicate<Throwable> retryable;

    public OracleRetryPolicy(int maxAttempts, Duration initialBackoff, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.retryable = retryable;
    }

    /**
     * Parse errors and throttling are retried; timeouts have their own single retry.
     */
    public static OracleRetryPolicy forOracle(int maxAttempts, Duration initialBackoff) {
        return new OracleRetryPolicy(maxAttempts, initialBackoff,
                e -> e instanceof OracleParseException || e instanceof OracleThrottledException);
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Build the Reactor retry spec. Exhaustion rethrows the last failure unchanged so
     * callers see the categorized exception instead of a wrapper.
     */
    public RetryBackoffSpec toRetry(String label) {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .filter(retryable)
                .doBeforeRetry(signal -> log.info("Retrying {} (attempt {}/{}): {}",
                        label, signal.totalRetries() + 2, maxAttempts, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
