package dev.resumescreener.service;

import dev.resumescreener.model.JobBreakdown;
import dev.resumescreener.model.OracleJobMatch;
import dev.resumescreener.model.SkillExperience;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a skill's experience total from the jobs the oracle reported for it.
 *
 * <p>Jobs are the same when their company matches (trimmed, case-insensitive); of two
 * duplicates the longer duration is kept, durations of duplicates are never summed.
 * Matches without a company name are dropped.
 */
@Slf4j
@Service
public class ExperienceAggregationService {

    public SkillExperience aggregate(String skillName, List<OracleJobMatch> matches) {
        if (skillName == null || skillName.isBlank()) {
            throw new IllegalArgumentException("Skill name must not be blank");
        }
        if (matches == null) {
            throw new IllegalArgumentException("Job matches for '" + skillName + "' must not be null");
        }

        Map<String, OracleJobMatch> byCompany = new LinkedHashMap<>();
        for (OracleJobMatch match : matches) {
            if (match == null) {
                continue;
            }
            if (match.durationMonths() < 0) {
                throw new IllegalArgumentException("Negative duration for '" + skillName + "' at " + match.company());
            }
            if (match.company() == null || match.company().isBlank()) {
                log.debug("Dropping job match without company for skill '{}'", skillName);
                continue;
            }
            byCompany.merge(companyKey(match.company()), match,
                    (kept, candidate) -> candidate.durationMonths() > kept.durationMonths() ? candidate : kept);
        }

        long totalMonths = 0;
        List<JobBreakdown> breakdown = new ArrayList<>(byCompany.size());
        for (OracleJobMatch match : byCompany.values()) {
            totalMonths += match.durationMonths();
            breakdown.add(new JobBreakdown(match.company().trim(), match.durationMonths(),
                    match.evidence() == null ? "" : match.evidence()));
        }

        return new SkillExperience(skillName, totalMonths / 12.0, breakdown);
    }

    /**
     * Merge the breakdowns of several resume skills that all count toward one requirement.
     */
    public SkillExperience merge(String skillName, Collection<SkillExperience> experiences) {
        List<OracleJobMatch> matches = new ArrayList<>();
        for (SkillExperience experience : experiences) {
            for (JobBreakdown job : experience.jobBreakdown()) {
                matches.add(OracleJobMatch.of(job.company(), job.durationMonths(), job.evidenceText()));
            }
        }
        return aggregate(skillName, matches);
    }

    static String companyKey(String company) {
        return company.trim().toLowerCase(Locale.ROOT);
    }
}
