package dev.resumescreener.model;

/**
 * A job the oracle reported as using a given skill.
 * Duration is already resolved: derived from the dates when the oracle omitted it.
 */
public record OracleJobMatch(
        String company,
        int durationMonths,
        String evidence,
        String startDate,
        String endDate) {

    public static OracleJobMatch of(String company, int durationMonths, String evidence) {
        return new OracleJobMatch(company, durationMonths, evidence, null, null);
    }
}
