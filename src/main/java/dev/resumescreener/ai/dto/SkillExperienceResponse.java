package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumescreener.ai.OracleParseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-skill job usage for one batch of skills. The JSON object is keyed by skill name.
 */
public class SkillExperienceResponse implements OracleResponse {

    private final Map<String, SkillJobs> skills = new LinkedHashMap<>();

    @JsonAnySetter
    public void put(String skillName, SkillJobs jobs) {
        skills.put(skillName, jobs);
    }

    public Map<String, SkillJobs> getSkills() {
        return skills;
    }

    @Override
    public void validate() {
        for (Map.Entry<String, SkillJobs> entry : skills.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            for (JobUse job : entry.getValue().jobs()) {
                if (job == null) {
                    throw new OracleParseException("Null job entry for skill " + entry.getKey());
                }
                if (job.durationMonths() != null && job.durationMonths() < 0) {
                    throw new OracleParseException("Negative duration_months for skill " + entry.getKey());
                }
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SkillJobs(@JsonProperty("jobs_using_skill") List<JobUse> jobsUsingSkill) {
        public List<JobUse> jobs() {
            return jobsUsingSkill == null ? List.of() : jobsUsingSkill;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobUse(
            String company,
            @JsonProperty("start_date") String startDate,
            @JsonProperty("end_date") String endDate,
            @JsonProperty("duration_months") Integer durationMonths,
            String evidence) {
    }
}
