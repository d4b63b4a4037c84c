package dev.resumescreener.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

/**
 * One job from a candidate's work history, as reported by the oracle.
 * A null {@code endPeriod} means the job is ongoing.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkHistoryEntry {
    String company;
    String title;
    String startPeriod;
    String endPeriod;
    int durationMonths;
    @Singular
    Set<String> technologies;

    @JsonIgnore
    public boolean isCurrent() {
        return endPeriod == null;
    }
}
