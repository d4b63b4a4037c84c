package dev.resumescreener.ai.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.resumescreener.ai.OracleParseException;
import dev.resumescreener.model.EvidenceGrade;
import dev.resumescreener.model.EvidenceStrength;

import java.util.Arrays;

/**
 * The oracle's grade of one resume excerpt against one skill.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceGradeResponse(
        @JsonProperty("has_skill") Boolean hasSkill,
        @JsonProperty("evidence_strength") String evidenceStrength,
        @JsonProperty("years_supported") Double yearsSupported,
        @JsonProperty("meets_years") Boolean meetsYears,
        String why,
        String quote,
        Double confidence) implements OracleResponse {

    static final int MAX_QUOTE_WORDS = 25;

    @Override
    public void validate() {
        if (hasSkill == null) {
            throw new OracleParseException("Evidence grade has no has_skill flag");
        }
        if (EvidenceStrength.fromLabel(evidenceStrength) == null) {
            throw new OracleParseException("Unknown evidence_strength: " + evidenceStrength);
        }
    }

    public EvidenceGrade toGrade() {
        double conf = confidence == null ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        return new EvidenceGrade(
                Boolean.TRUE.equals(hasSkill),
                EvidenceStrength.fromLabel(evidenceStrength),
                truncateWords(quote, MAX_QUOTE_WORDS),
                why == null ? "" : why.trim(),
                conf);
    }

    static String truncateWords(String text, int maxWords) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String[] words = text.trim().split("\\s+");
        if (words.length <= maxWords) {
            return String.join(" ", words);
        }
        return String.join(" ", Arrays.copyOf(words, maxWords));
    }
}
