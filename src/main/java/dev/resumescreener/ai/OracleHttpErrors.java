package dev.resumescreener.ai;

import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Set;

/**
 * Maps provider HTTP failures onto the oracle error taxonomy.
 */
final class OracleHttpErrors {

    private static final Set<Integer> THROTTLING_STATUSES = Set.of(429, 500, 502, 503, 504);

    private OracleHttpErrors() {
    }

    static OracleException translate(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        if (THROTTLING_STATUSES.contains(status)) {
            return new OracleThrottledException(status, "Oracle provider throttled the call (HTTP " + status + ")", e);
        }
        return new OracleException("Oracle provider rejected the call (HTTP " + status + ")", e);
    }
}
