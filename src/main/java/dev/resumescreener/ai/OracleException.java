package dev.resumescreener.ai;

/**
 * Base class for failures of the text-understanding oracle.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
