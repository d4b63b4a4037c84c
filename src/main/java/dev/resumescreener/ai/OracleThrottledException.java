package dev.resumescreener.ai;

/**
 * The provider rejected the call as rate-limited or temporarily unavailable.
 */
public class OracleThrottledException extends OracleException {

    private final int statusCode;

    public OracleThrottledException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
