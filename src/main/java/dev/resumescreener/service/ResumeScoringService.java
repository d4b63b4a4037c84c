package dev.resumescreener.service;

import dev.resumescreener.config.RetrievalConfig;
import dev.resumescreener.config.ScoringConfig;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.EvidenceMatch;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.JobRequirements;
import dev.resumescreener.model.ResumeProfile;
import dev.resumescreener.model.ScoreResult;
import dev.resumescreener.model.ScoringReport;
import dev.resumescreener.model.SkillScore;
import dev.resumescreener.model.StoredResume;
import dev.resumescreener.model.WorkHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Scores a stored resume against a job: per-skill evidence retrieval and scoring with
 * bounded concurrency, a join over all skills, aggregation and persistence of the run.
 *
 * <p>A skill whose retrieval or grading fails is scored as unmatched with status
 * {@code EVIDENCE_UNAVAILABLE} and a note; the request itself still completes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeScoringService {

    private static final String SEPARATOR = "========================================";

    private final OracleExtractionService extractionService;
    private final EvidenceRetrievalService retrievalService;
    private final SkillExperienceLookup experienceLookup;
    private final SkillScoringService skillScoringService;
    private final ScoreAggregationService aggregationService;
    private final ResumeStoreService storeService;
    private final ScoringConfig scoringConfig;
    private final RetrievalConfig retrievalConfig;
    private final ScreeningMetrics metrics;

    /**
     * Extract requirements from job description text, then score.
     */
    public Mono<ScoringReport> score(String resumeId, String jdText) {
        return extractionService.extractJobRequirements(jdText)
                .flatMap(requirements -> score(resumeId, requirements));
    }

    public Mono<ScoringReport> score(String resumeId, JobRequirements requirements) {
        if (resumeId == null || resumeId.isBlank()) {
            return Mono.error(new IllegalArgumentException("Resume id must not be blank"));
        }
        if (requirements == null) {
            return Mono.error(new IllegalArgumentException("Job requirements must not be null"));
        }

        return Mono.fromCallable(() -> storeService.loadResume(resumeId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stored -> stored.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ResumeNotFoundException(resumeId))))
                .flatMap(resume -> evaluate(resume, requirements));
    }

    private Mono<ScoringReport> evaluate(StoredResume resume, JobRequirements requirements) {
        long start = System.currentTimeMillis();
        List<JobRequirement> evaluated = requirements.requirements().stream()
                .filter(r -> scoringConfig.isEvaluateNiceToHave() || isCore(r))
                .toList();

        log.info(SEPARATOR);
        log.info("Scoring resume {} against '{}' ({} skills)", resume.resumeId(), requirements.jobTitle(),
                evaluated.size());
        log.info(SEPARATOR);

        return Flux.fromIterable(evaluated)
                .flatMapSequential(requirement -> evaluateSkill(resume, requirement), scoringConfig.getConcurrency())
                .collectList()
                .map(skillScores -> {
                    ResumeProfile profile = resume.profile();
                    return aggregationService.aggregate(
                            skillScores,
                            evaluated,
                            resumeTotalYears(resume),
                            requirements.requiredTotalYears(),
                            profile.hasCertifications(),
                            profile.hasProjects());
                })
                .flatMap(result -> saveRun(resume.resumeId(), requirements, result)
                        .map(runId -> new ScoringReport(runId.orElse(null), resume.resumeId(), requirements, result)))
                .doOnNext(report -> {
                    long duration = System.currentTimeMillis() - start;
                    metrics.recordScoringCompleted(report.result().overallScore(), duration);
                    log.info("Resume {} scored {} for '{}' in {}ms", resume.resumeId(),
                            report.result().overallScore(), requirements.jobTitle(), duration);
                });
    }

    Mono<SkillScore> evaluateSkill(StoredResume resume, JobRequirement requirement) {
        String skillName = requirement.getSkillName();
        Mono<EvidenceMatch> evidence = retrievalService
                .retrieve(requirement, resume.resumeId(), retrievalConfig.getTopK())
                .onErrorResume(e -> {
                    log.warn("Evidence unavailable for '{}': {}", skillName, e.getMessage());
                    metrics.recordSkillDegraded();
                    return Mono.just(EvidenceMatch.unavailable(skillName, describe(e)));
                });

        return Mono.zip(evidence, experienceLookup.lookup(requirement, resume.skillExperience()))
                .map(tuple -> skillScoringService.score(tuple.getT1(), tuple.getT2(), requirement));
    }

    private Mono<Optional<String>> saveRun(String resumeId, JobRequirements requirements, ScoreResult result) {
        return Mono.fromCallable(() -> Optional.of(storeService.saveMatchRun(resumeId, requirements, result)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Could not persist match run for resume {}: {}", resumeId, e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    /**
     * The profile's stated total, or the summed work history when the profile has none.
     */
    static double resumeTotalYears(StoredResume resume) {
        double stated = resume.profile().getTotalYears();
        if (stated > 0) {
            return stated;
        }
        int months = resume.workHistory().stream().mapToInt(WorkHistoryEntry::getDurationMonths).sum();
        return months / 12.0;
    }

    private static boolean isCore(JobRequirement requirement) {
        return requirement.getImportance() != null && requirement.getImportance().isCore();
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
