package dev.resumescreener.ai;

/**
 * The oracle answered, but not with JSON matching the expected schema.
 */
public class OracleParseException extends OracleException {

    public OracleParseException(String message) {
        super(message);
    }

    public OracleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
