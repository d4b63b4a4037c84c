package dev.resumescreener.service;

import dev.resumescreener.ai.OracleClient;
import dev.resumescreener.ai.OracleTimeoutException;
import dev.resumescreener.ai.PromptType;
import dev.resumescreener.ai.Prompts;
import dev.resumescreener.ai.dto.EvidenceGradeResponse;
import dev.resumescreener.ai.dto.JobRequirementsResponse;
import dev.resumescreener.ai.dto.ResumeProfileResponse;
import dev.resumescreener.ai.dto.SkillExperienceResponse;
import dev.resumescreener.ai.dto.SkillVariantMatchResponse;
import dev.resumescreener.ai.dto.WorkHistoryResponse;
import dev.resumescreener.model.EvidenceGrade;
import dev.resumescreener.model.JobRequirements;
import dev.resumescreener.model.OracleJobMatch;
import dev.resumescreener.model.ResumeProfile;
import dev.resumescreener.model.WorkHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed extraction operations over the text oracle.
 *
 * <p>Resume-side extractions degrade to an empty result when the oracle times out;
 * job-description extraction and evidence grading propagate every failure to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OracleExtractionService {

    private final OracleClient oracleClient;
    private final Clock clock;

    public Mono<ResumeProfile> extractProfile(String resumeText) {
        return oracleClient.call(PromptType.RESUME_PROFILE, resumeText, Prompts.resumeProfile(resumeText),
                        ResumeProfileResponse.class)
                .map(ResumeProfileResponse::toProfile)
                .doOnNext(p -> log.info("Extracted profile: title='{}', {} skills, {} years",
                        p.getTitle(), p.getSkills().size(), p.getTotalYears()))
                .onErrorResume(OracleTimeoutException.class, e -> {
                    log.warn("Profile extraction timed out, continuing with an empty profile");
                    return Mono.just(ResumeProfile.empty());
                });
    }

    public Mono<List<WorkHistoryEntry>> extractWorkHistory(String resumeText) {
        return oracleClient.call(PromptType.WORK_HISTORY, resumeText, Prompts.workHistory(resumeText),
                        WorkHistoryResponse.class)
                .map(this::toEntries)
                .doOnNext(entries -> log.info("Extracted {} work history entries", entries.size()))
                .onErrorResume(OracleTimeoutException.class, e -> {
                    log.warn("Work history extraction timed out, continuing without job context");
                    return Mono.just(List.of());
                });
    }

    /**
     * Per-skill job matches for one batch of skills, keyed by the skill names the oracle echoed back.
     */
    public Mono<Map<String, List<OracleJobMatch>>> extractSkillExperience(List<String> skills, String resumeText) {
        if (skills.isEmpty()) {
            return Mono.just(Map.of());
        }
        String cacheInput = String.join("|", skills) + "\n" + resumeText;
        return oracleClient.call(PromptType.SKILL_EXPERIENCE, cacheInput,
                        Prompts.skillExperience(skills, resumeText), SkillExperienceResponse.class)
                .map(this::toJobMatches)
                .onErrorResume(OracleTimeoutException.class, e -> {
                    log.warn("Skill experience extraction timed out for batch {}", skills);
                    return Mono.just(Map.of());
                });
    }

    public Mono<JobRequirements> extractJobRequirements(String jdText) {
        if (jdText == null || jdText.isBlank()) {
            return Mono.error(new IllegalArgumentException("Job description text must not be blank"));
        }
        return oracleClient.call(PromptType.JOB_REQUIREMENTS, jdText, Prompts.jobRequirements(jdText),
                        JobRequirementsResponse.class)
                .map(JobRequirementsResponse::toRequirements)
                .doOnNext(jd -> log.info("Extracted job requirements: title='{}', {} skills ({} core), {} years",
                        jd.jobTitle(), jd.requirements().size(), jd.coreRequirements().size(),
                        jd.requiredTotalYears()));
    }

    public Mono<EvidenceGrade> gradeEvidence(String skillName, double minYears, String chunkText) {
        if (chunkText == null || chunkText.isBlank()) {
            return Mono.error(new IllegalArgumentException("Cannot grade blank evidence for " + skillName));
        }
        String cacheInput = skillName + "\n" + minYears + "\n" + chunkText;
        return oracleClient.call(PromptType.EVIDENCE_GRADE, cacheInput,
                        Prompts.evidenceGrade(skillName, minYears, chunkText), EvidenceGradeResponse.class)
                .map(EvidenceGradeResponse::toGrade)
                .doOnNext(g -> log.debug("Graded '{}': has_skill={} strength={} confidence={}",
                        skillName, g.hasSkill(), g.strength(), g.confidence()));
    }

    /**
     * Resume skill names the oracle judges to count toward {@code skillName}.
     */
    public Mono<List<String>> matchSkillVariants(String skillName, double minYears, Collection<String> resumeSkills) {
        if (resumeSkills.isEmpty()) {
            return Mono.just(List.of());
        }
        String cacheInput = skillName + "\n" + minYears + "\n" + String.join("|", resumeSkills);
        return oracleClient.call(PromptType.SKILL_VARIANT_MATCH, cacheInput,
                        Prompts.skillVariantMatch(skillName, minYears, resumeSkills), SkillVariantMatchResponse.class)
                .map(SkillVariantMatchResponse::matchedSkills);
    }

    private List<WorkHistoryEntry> toEntries(WorkHistoryResponse response) {
        List<WorkHistoryEntry> entries = new ArrayList<>();
        for (WorkHistoryResponse.Job job : response.workHistory()) {
            if (job.company() == null || job.company().isBlank()) {
                continue;
            }
            WorkHistoryEntry.WorkHistoryEntryBuilder builder = WorkHistoryEntry.builder()
                    .company(job.company().trim())
                    .title(job.title())
                    .startPeriod(job.startDate())
                    .endPeriod(WorkPeriods.isPresent(job.endDate()) ? null : job.endDate())
                    .durationMonths(WorkPeriods.resolveDuration(job.durationMonths(), job.startDate(),
                            job.endDate(), clock));
            if (job.technologies() != null) {
                job.technologies().stream()
                        .filter(t -> t != null && !t.isBlank())
                        .map(String::trim)
                        .forEach(builder::technology);
            }
            entries.add(builder.build());
        }
        return entries;
    }

    private Map<String, List<OracleJobMatch>> toJobMatches(SkillExperienceResponse response) {
        Map<String, List<OracleJobMatch>> result = new LinkedHashMap<>();
        response.getSkills().forEach((skill, jobs) -> {
            if (skill == null || skill.isBlank()) {
                return;
            }
            List<OracleJobMatch> matches = new ArrayList<>();
            if (jobs != null) {
                for (SkillExperienceResponse.JobUse use : jobs.jobs()) {
                    int months = WorkPeriods.resolveDuration(use.durationMonths(), use.startDate(),
                            use.endDate(), clock);
                    matches.add(new OracleJobMatch(use.company(), months, use.evidence(),
                            use.startDate(), use.endDate()));
                }
            }
            result.put(skill.trim(), matches);
        });
        return result;
    }
}
