package dev.resumescreener.service;

import dev.resumescreener.config.IngestionConfig;
import dev.resumescreener.embedding.EmbeddingClient;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.Chunk;
import dev.resumescreener.model.IngestionResult;
import dev.resumescreener.model.OracleJobMatch;
import dev.resumescreener.model.ResumeDocument;
import dev.resumescreener.model.ResumeProfile;
import dev.resumescreener.model.SkillExperience;
import dev.resumescreener.model.WorkHistoryEntry;
import dev.resumescreener.vector.VectorIndex;
import dev.resumescreener.vector.VectorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resume ingestion pipeline: profile and work-history extraction, chunking, chunk
 * indexing and skill-experience aggregation, persisted as one unit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeIngestionService {

    private static final String SEPARATOR = "========================================";

    private final OracleExtractionService extractionService;
    private final ChunkingService chunkingService;
    private final ExperienceAggregationService aggregationService;
    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final ResumeStoreService storeService;
    private final IngestionConfig config;
    private final ScreeningMetrics metrics;
    private final Clock clock;

    /**
     * Ingest normalized resume text under {@code resumeId}, replacing any earlier ingestion.
     *
     * @return Mono with the ingestion summary
     */
    public Mono<IngestionResult> ingest(String resumeId, String text) {
        if (resumeId == null || resumeId.isBlank()) {
            return Mono.error(new IllegalArgumentException("Resume id must not be blank"));
        }
        if (text == null) {
            return Mono.error(new IllegalArgumentException("Resume text must not be null"));
        }

        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            ResumeDocument document = new ResumeDocument(resumeId, text, clock.instant());
            log.info(SEPARATOR);
            log.info("Ingesting resume {} ({} chars)", resumeId, text.length());
            log.info(SEPARATOR);

            if (text.isBlank()) {
                log.warn("Resume {} has no text, storing an empty profile", resumeId);
                return persist(document, ResumeProfile.empty(), List.of(), List.of(), Map.of(), start)
                        .flatMap(result -> vectorIndex.replace(resumeId, List.of()).thenReturn(result));
            }

            return Mono.zip(extractionService.extractProfile(text), extractionService.extractWorkHistory(text))
                    .flatMap(tuple -> {
                        ResumeProfile profile = tuple.getT1();
                        List<WorkHistoryEntry> workHistory = tuple.getT2();
                        List<Chunk> chunks = chunkingService.chunk(text, workHistory);
                        log.info("Resume {}: {} skills, {} jobs, {} chunks", resumeId, profile.getSkills().size(),
                                workHistory.size(), chunks.size());

                        // index entries are swapped only once the database holds the new resume
                        return Mono.zip(
                                        embedChunks(resumeId, chunks),
                                        buildSkillExperience(topSkills(profile), text))
                                .flatMap(embedded -> persist(document, profile, workHistory, chunks,
                                                embedded.getT2(), start)
                                        .flatMap(result -> replaceIndex(resumeId, embedded.getT1())
                                                .thenReturn(result)));
                    });
        }).doOnError(e -> {
            metrics.recordIngestionFailure();
            log.error("Ingestion of resume {} failed: {}", resumeId, e.getMessage());
        });
    }

    /**
     * Re-extract skill experience from the stored text and swap the whole map in at once.
     */
    public Mono<Map<String, SkillExperience>> refreshSkillExperience(String resumeId) {
        return Mono.fromCallable(() -> storeService.loadResume(resumeId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stored -> stored.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ResumeNotFoundException(resumeId))))
                .flatMap(stored -> buildSkillExperience(topSkills(stored.profile()), stored.text()))
                .flatMap(map -> Mono.fromRunnable(() -> storeService.replaceSkillExperience(resumeId, map))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenReturn(map));
    }

    /**
     * Rebuild the vector index entries of a stored resume from its persisted chunks.
     *
     * @return Mono with the number of chunks indexed
     */
    public Mono<Integer> reindex(String resumeId) {
        return Mono.fromCallable(() -> storeService.loadChunks(resumeId))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(chunks -> chunks.isEmpty()
                        ? Mono.error(new ResumeNotFoundException(resumeId))
                        : indexChunks(resumeId, chunks));
    }

    /**
     * Embed every chunk, then swap the resume's index entries in one step. A failed
     * embedding leaves the previous entries in place.
     */
    Mono<Integer> indexChunks(String resumeId, List<Chunk> chunks) {
        return embedChunks(resumeId, chunks)
                .flatMap(records -> replaceIndex(resumeId, records));
    }

    private Mono<List<VectorRecord>> embedChunks(String resumeId, List<Chunk> chunks) {
        return Flux.fromIterable(chunks)
                .flatMap(chunk -> embeddingClient.embed(chunk.text())
                        .map(vector -> toRecord(resumeId, chunk, vector)), config.getConcurrency())
                .collectList();
    }

    private Mono<Integer> replaceIndex(String resumeId, List<VectorRecord> records) {
        return vectorIndex.replace(resumeId, records)
                .doOnNext(count -> log.info("Indexed {} chunks for resume {}", count, resumeId));
    }

    /**
     * Skill experience for the given skills, extracted in batches with bounded concurrency.
     * A failed batch is skipped so one bad answer does not lose the others.
     */
    Mono<Map<String, SkillExperience>> buildSkillExperience(List<String> skills, String text) {
        if (skills.isEmpty()) {
            return Mono.just(Map.of());
        }
        return Flux.fromIterable(partition(skills, config.getSkillBatchSize()))
                .flatMap(batch -> extractionService.extractSkillExperience(batch, text)
                        .onErrorResume(e -> {
                            log.warn("Skill experience batch {} failed, skipping: {}", batch, e.getMessage());
                            return Mono.just(Map.of());
                        }), config.getConcurrency())
                .collectList()
                .map(this::aggregateBatches);
    }

    private Map<String, SkillExperience> aggregateBatches(List<Map<String, List<OracleJobMatch>>> batches) {
        Map<String, List<OracleJobMatch>> merged = new LinkedHashMap<>();
        for (Map<String, List<OracleJobMatch>> batch : batches) {
            batch.forEach((skill, matches) -> merged.computeIfAbsent(skill, k -> new ArrayList<>()).addAll(matches));
        }
        Map<String, SkillExperience> result = new LinkedHashMap<>();
        merged.forEach((skill, matches) -> result.put(skill, aggregationService.aggregate(skill, matches)));
        long withExperience = result.values().stream().filter(e -> e.totalYears() > 0).count();
        log.info("Skill experience: {} skills, {} with work usage", result.size(), withExperience);
        return result;
    }

    private Mono<IngestionResult> persist(ResumeDocument document, ResumeProfile profile,
            List<WorkHistoryEntry> workHistory, List<Chunk> chunks, Map<String, SkillExperience> skillExperience,
            long start) {
        return Mono.fromRunnable(() -> storeService.saveIngestion(document, profile, workHistory, chunks,
                        skillExperience))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.fromCallable(() -> {
                    long duration = System.currentTimeMillis() - start;
                    int withExperience = (int) skillExperience.values().stream()
                            .filter(e -> e.totalYears() > 0).count();
                    metrics.recordResumeIngested(chunks.size(), duration);
                    log.info("Resume {} ingested in {}ms", document.resumeId(), duration);
                    return new IngestionResult(document.resumeId(), chunks.size(), workHistory.size(),
                            profile.getSkills().size(), withExperience, duration);
                }));
    }

    private List<String> topSkills(ResumeProfile profile) {
        List<String> skills = profile.getSkills();
        return skills.size() > config.getTopSkills() ? skills.subList(0, config.getTopSkills()) : skills;
    }

    private static VectorRecord toRecord(String resumeId, Chunk chunk, float[] vector) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("resume_id", resumeId);
        metadata.put("sequence_index", String.valueOf(chunk.sequenceIndex()));
        if (chunk.jobContext() != null && chunk.jobContext().getCompany() != null) {
            metadata.put("company", chunk.jobContext().getCompany());
        }
        return new VectorRecord(chunk.vectorKey(resumeId), resumeId, vector, chunk.text(), metadata);
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        int batchSize = Math.max(1, size);
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += batchSize) {
            partitions.add(List.copyOf(list.subList(i, Math.min(i + batchSize, list.size()))));
        }
        return partitions;
    }
}
