package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumescreener.ai.OracleParseException;

import java.util.List;

/**
 * Jobs listed in a resume's work history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkHistoryResponse(@JsonProperty("work_history") List<Job> workHistory) implements OracleResponse {

    @Override
    public void validate() {
        if (workHistory == null) {
            throw new OracleParseException("Work history response has no work_history array");
        }
        for (Job job : workHistory) {
            if (job == null) {
                throw new OracleParseException("Work history contains a null entry");
            }
            if (job.durationMonths() != null && job.durationMonths() < 0) {
                throw new OracleParseException("Negative duration_months for " + job.company());
            }
        }
    }

    /**
     * @param durationMonths null when the oracle only gave dates
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Job(
            String company,
            String title,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate,
            @JsonProperty("duration_months") Integer durationMonths,
            List<String> technologies) {
    }
}
