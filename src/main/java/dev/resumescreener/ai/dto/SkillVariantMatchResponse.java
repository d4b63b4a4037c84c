package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import dev.resumescreener.ai.OracleParseException;

import java.util.List;

/**
 * Resume skill names the oracle judged to count toward one requirement. Bound from a bare JSON array.
 */
public record SkillVariantMatchResponse(List<String> skills) implements OracleResponse {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SkillVariantMatchResponse of(List<String> skills) {
        return new SkillVariantMatchResponse(skills);
    }

    @Override
    public void validate() {
        if (skills == null) {
            throw new OracleParseException("Skill variant match is not a JSON array");
        }
    }

    public List<String> matchedSkills() {
        return skills.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toList();
    }
}
