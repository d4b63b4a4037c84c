package dev.resumescreener.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A resume as read back from persistence for scoring.
 */
public record StoredResume(
        String resumeId,
        String text,
        ResumeProfile profile,
        List<WorkHistoryEntry> workHistory,
        Map<String, SkillExperience> skillExperience,
        Instant ingestedAt) {

    public StoredResume {
        workHistory = workHistory == null ? List.of() : List.copyOf(workHistory);
        skillExperience = skillExperience == null ? Map.of() : Map.copyOf(skillExperience);
    }
}
