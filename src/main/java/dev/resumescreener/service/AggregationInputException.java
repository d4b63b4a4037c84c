package dev.resumescreener.service;

/**
 * Skill scores and requirements handed to the aggregator do not describe the same job.
 */
public class AggregationInputException extends RuntimeException {

    public AggregationInputException(String message) {
        super(message);
    }
}
