package dev.resumescreener.model;

/**
 * One job that contributed to a skill's experience total.
 */
public record JobBreakdown(String company, int durationMonths, String evidenceText) {
}
