package dev.resumescreener.service;

import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.SkillExperience;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds a requirement's experience in a resume's skill-experience map.
 *
 * <p>Tries, in order: the exact skill name, the name ignoring case, the requirement's
 * name variants, and finally an oracle judgement of which resume skills count toward the
 * requirement. Several matched skills are merged with the company de-duplication of
 * {@link ExperienceAggregationService}. Oracle failures fall back to zero experience.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillExperienceLookup {

    private final ExperienceAggregationService aggregationService;
    private final OracleExtractionService extractionService;

    public Mono<SkillExperience> lookup(JobRequirement requirement, Map<String, SkillExperience> experienceMap) {
        String skillName = requirement.getSkillName();
        if (experienceMap == null || experienceMap.isEmpty()) {
            return Mono.just(SkillExperience.empty(skillName));
        }

        SkillExperience exact = experienceMap.get(skillName);
        if (exact != null) {
            return Mono.just(rename(exact, skillName));
        }

        Map<String, SkillExperience> byLowerName = new LinkedHashMap<>();
        experienceMap.forEach((name, experience) -> byLowerName.putIfAbsent(lower(name), experience));

        SkillExperience ignoringCase = byLowerName.get(lower(skillName));
        if (ignoringCase != null) {
            return Mono.just(rename(ignoringCase, skillName));
        }

        List<SkillExperience> variants = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String variant : requirement.getNameVariants()) {
            SkillExperience found = byLowerName.get(lower(variant));
            if (found != null && seen.add(lower(variant))) {
                variants.add(found);
            }
        }
        if (!variants.isEmpty()) {
            log.debug("'{}' matched {} name variants", skillName, variants.size());
            return Mono.just(aggregationService.merge(skillName, variants));
        }

        return extractionService.matchSkillVariants(skillName, requirement.getMinYears(), experienceMap.keySet())
                .map(matched -> {
                    List<SkillExperience> found = new ArrayList<>();
                    Set<String> used = new HashSet<>();
                    for (String name : matched) {
                        SkillExperience experience = byLowerName.get(lower(name));
                        if (experience != null && used.add(lower(name))) {
                            found.add(experience);
                        }
                    }
                    if (found.isEmpty()) {
                        log.debug("No resume skill counts toward '{}'", skillName);
                        return SkillExperience.empty(skillName);
                    }
                    log.info("'{}' matched resume skills {}", skillName, matched);
                    return aggregationService.merge(skillName, found);
                })
                .onErrorResume(e -> {
                    log.warn("Skill variant matching failed for '{}', assuming no experience: {}",
                            skillName, e.getMessage());
                    return Mono.just(SkillExperience.empty(skillName));
                });
    }

    private static SkillExperience rename(SkillExperience experience, String skillName) {
        return new SkillExperience(skillName, experience.totalYears(), experience.jobBreakdown());
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
