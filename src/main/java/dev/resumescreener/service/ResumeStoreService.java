package dev.resumescreener.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescreener.entity.MatchRunEntity;
import dev.resumescreener.entity.ResumeChunkEntity;
import dev.resumescreener.entity.ResumeProfileEntity;
import dev.resumescreener.model.Chunk;
import dev.resumescreener.model.JobRequirements;
import dev.resumescreener.model.ResumeDocument;
import dev.resumescreener.model.ResumeProfile;
import dev.resumescreener.model.ScoreResult;
import dev.resumescreener.model.SkillExperience;
import dev.resumescreener.model.StoredResume;
import dev.resumescreener.model.WorkHistoryEntry;
import dev.resumescreener.repository.MatchRunRepository;
import dev.resumescreener.repository.ResumeChunkRepository;
import dev.resumescreener.repository.ResumeProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * SQLite-backed storage of ingested resumes, their chunks and scoring runs.
 * Resume aggregates are stored as JSON documents inside the rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeStoreService {

    private static final TypeReference<List<WorkHistoryEntry>> WORK_HISTORY_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, SkillExperience>> SKILL_EXPERIENCE_TYPE =
            new TypeReference<>() {
            };

    private final ResumeProfileRepository profileRepository;
    private final ResumeChunkRepository chunkRepository;
    private final MatchRunRepository matchRunRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Store a complete ingestion, replacing any earlier one for the same resume.
     */
    @Transactional
    public void saveIngestion(ResumeDocument document, ResumeProfile profile, List<WorkHistoryEntry> workHistory,
            List<Chunk> chunks, Map<String, SkillExperience> skillExperience) {
        String resumeId = document.resumeId();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime ingestedAt = LocalDateTime.ofInstant(document.ingestedAt(), ZoneOffset.UTC);

        ResumeProfileEntity entity = profileRepository.findById(resumeId)
                .orElseGet(() -> ResumeProfileEntity.builder().resumeId(resumeId).build());
        entity.setCandidateName(profile.getName());
        entity.setTitle(profile.getTitle());
        entity.setTotalYears(profile.getTotalYears());
        entity.setResumeText(document.text());
        entity.setProfileJson(toJson(profile));
        entity.setWorkHistoryJson(toJson(workHistory));
        entity.setSkillExperienceJson(toJson(skillExperience));
        entity.setChunkCount(chunks.size());
        entity.setIngestedAt(ingestedAt);
        entity.setUpdatedAt(now);
        profileRepository.save(entity);

        int removed = chunkRepository.deleteAllByResumeId(resumeId);
        List<ResumeChunkEntity> chunkEntities = chunks.stream()
                .map(chunk -> ResumeChunkEntity.builder()
                        .resumeId(resumeId)
                        .sequenceIndex(chunk.sequenceIndex())
                        .vectorKey(chunk.vectorKey(resumeId))
                        .text(chunk.text())
                        .startWord(chunk.startWord())
                        .wordCount(chunk.wordCount())
                        .overlapWords(chunk.overlapWithPredecessor())
                        .jobCompany(chunk.jobContext() != null ? chunk.jobContext().getCompany() : null)
                        .jobTitle(chunk.jobContext() != null ? chunk.jobContext().getTitle() : null)
                        .build())
                .toList();
        chunkRepository.saveAll(chunkEntities);

        log.info("Stored resume {}: {} chunks ({} replaced), {} skills", resumeId, chunkEntities.size(), removed,
                skillExperience.size());
    }

    /**
     * Swap in a new skill-experience map for an already ingested resume as one update.
     *
     * @throws ResumeNotFoundException if the resume was never ingested
     */
    @Transactional
    public void replaceSkillExperience(String resumeId, Map<String, SkillExperience> skillExperience) {
        ResumeProfileEntity entity = profileRepository.findById(resumeId)
                .orElseThrow(() -> new ResumeNotFoundException(resumeId));
        entity.setSkillExperienceJson(toJson(skillExperience));
        entity.setUpdatedAt(LocalDateTime.now(clock));
        profileRepository.save(entity);
        log.info("Replaced skill experience of resume {} ({} skills)", resumeId, skillExperience.size());
    }

    @Transactional(readOnly = true)
    public Optional<StoredResume> loadResume(String resumeId) {
        return profileRepository.findById(resumeId).map(entity -> new StoredResume(
                entity.getResumeId(),
                entity.getResumeText(),
                fromJson(entity.getProfileJson(), ResumeProfile.class),
                fromJson(entity.getWorkHistoryJson(), WORK_HISTORY_TYPE),
                fromJson(entity.getSkillExperienceJson(), SKILL_EXPERIENCE_TYPE),
                entity.getIngestedAt().toInstant(ZoneOffset.UTC)));
    }

    /**
     * All chunks of a resume in document order. Job context carries only company and title.
     */
    @Transactional(readOnly = true)
    public List<Chunk> loadChunks(String resumeId) {
        return chunkRepository.findByResumeIdOrderBySequenceIndexAsc(resumeId).stream()
                .map(e -> new Chunk(e.getText(), e.getSequenceIndex(), e.getStartWord(), e.getWordCount(),
                        e.getOverlapWords(), e.getJobCompany() == null ? null
                                : WorkHistoryEntry.builder().company(e.getJobCompany()).title(e.getJobTitle())
                                        .build()))
                .toList();
    }

    /**
     * Persist a scoring run.
     *
     * @return the new match run id
     */
    @Transactional
    public String saveMatchRun(String resumeId, JobRequirements requirements, ScoreResult result) {
        String id = UUID.randomUUID().toString();
        matchRunRepository.save(MatchRunEntity.builder()
                .id(id)
                .resumeId(resumeId)
                .jobTitle(requirements.jobTitle())
                .overallScore(result.overallScore())
                .coreSkillsScore(result.coreSkillsScore())
                .experienceScore(result.experienceScore())
                .additionalScore(result.additionalScore())
                .requirementsJson(toJson(requirements))
                .resultJson(toJson(result))
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.debug("Saved match run {} for resume {}", id, resumeId);
        return id;
    }

    @Transactional(readOnly = true)
    public List<MatchRunEntity> findMatchRuns(String resumeId) {
        return matchRunRepository.findByResumeIdOrderByCreatedAtDesc(resumeId);
    }

    public ScoreResult readResult(MatchRunEntity run) {
        return fromJson(run.getResultJson(), ScoreResult.class);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt stored " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt stored " + type.getType().getTypeName(), e);
        }
    }
}
