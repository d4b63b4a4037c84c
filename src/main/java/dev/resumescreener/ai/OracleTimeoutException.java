package dev.resumescreener.ai;

import java.time.Duration;

/**
 * The oracle did not answer within the call timeout, including the longer retry.
 */
public class OracleTimeoutException extends OracleException {

    public OracleTimeoutException(Duration timeout, Throwable cause) {
        super("Oracle call timed out after " + timeout.toSeconds() + "s", cause);
    }
}
