package dev.resumescreener.ai.dto;

/**
 * A typed oracle answer. Implementations check their own schema after Jackson binding.
 */
public interface OracleResponse {

    /**
     * @throws dev.resumescreener.ai.OracleParseException if required fields are missing or out of range
     */
    void validate();
}
