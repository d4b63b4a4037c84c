package dev.resumescreener.service;

import dev.resumescreener.ai.OracleParseException;
import dev.resumescreener.config.IngestionConfig;
import dev.resumescreener.embedding.EmbeddingClient;
import dev.resumescreener.embedding.EmbeddingException;
import dev.resumescreener.metrics.ScreeningMetrics;
import dev.resumescreener.model.Chunk;
import dev.resumescreener.model.OracleJobMatch;
import dev.resumescreener.model.ResumeDocument;
import dev.resumescreener.model.ResumeProfile;
import dev.resumescreener.model.SkillExperience;
import dev.resumescreener.model.StoredResume;
import dev.resumescreener.model.VectorHit;
import dev.resumescreener.model.WorkHistoryEntry;
import dev.resumescreener.vector.InMemoryVectorIndex;
import dev.resumescreener.vector.VectorIndex;
import dev.resumescreener.vector.VectorRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResumeIngestionServiceTest {

    private static final String RESUME_ID = "r1";
    private static final String TEXT = "Jane Doe. Backend engineer at Acme building Java and Kafka services since 2021.";

    @Mock
    private OracleExtractionService extractionService;

    @Mock
    private EmbeddingClient embeddingClient;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private ResumeStoreService storeService;

    @Captor
    private ArgumentCaptor<Map<String, SkillExperience>> experienceCaptor;

    @Captor
    private ArgumentCaptor<List<VectorRecord>> recordsCaptor;

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-15T00:00:00Z"), ZoneOffset.UTC);
    private SimpleMeterRegistry meterRegistry;
    private ResumeIngestionService service;

    private final ResumeProfile profile = ResumeProfile.builder()
            .name("Jane Doe")
            .totalYears(3)
            .skill("Java")
            .skill("Kafka")
            .skill("Go")
            .build();

    private final WorkHistoryEntry acme = WorkHistoryEntry.builder()
            .company("Acme")
            .title("Backend engineer")
            .startPeriod("2021-01")
            .durationMonths(36)
            .technology("Java")
            .build();

    @BeforeEach
    void setUp() {
        IngestionConfig config = new IngestionConfig();
        config.setSkillBatchSize(2);
        config.setConcurrency(2);
        meterRegistry = new SimpleMeterRegistry();

        service = new ResumeIngestionService(extractionService, new ChunkingService(250, 50),
                new ExperienceAggregationService(), embeddingClient, vectorIndex, storeService, config,
                new ScreeningMetrics(meterRegistry), clock);
    }

    private void stubIndexing() {
        when(embeddingClient.embed(anyString())).thenReturn(Mono.just(new float[]{1f, 0f}));
        when(vectorIndex.replace(eq(RESUME_ID), anyList()))
                .thenAnswer(invocation -> Mono.just(invocation.<List<VectorRecord>>getArgument(1).size()));
    }

    @Nested
    @DisplayName("Ingest")
    class IngestTests {

        @Test
        @DisplayName("Should extract, chunk, index and persist a resume")
        void shouldIngestResume() {
            when(extractionService.extractProfile(TEXT)).thenReturn(Mono.just(profile));
            when(extractionService.extractWorkHistory(TEXT)).thenReturn(Mono.just(List.of(acme)));
            when(extractionService.extractSkillExperience(List.of("Java", "Kafka"), TEXT)).thenReturn(Mono.just(Map.of(
                    "Java", List.of(OracleJobMatch.of("Acme", 24, "Java services"), OracleJobMatch.of("acme", 12, "")),
                    "Kafka", List.of(OracleJobMatch.of("Acme", 12, "Kafka consumers")))));
            when(extractionService.extractSkillExperience(List.of("Go"), TEXT))
                    .thenReturn(Mono.error(new OracleParseException("truncated answer")));
            stubIndexing();

            StepVerifier.create(service.ingest(RESUME_ID, TEXT))
                    .assertNext(result -> {
                        assertThat(result.resumeId()).isEqualTo(RESUME_ID);
                        assertThat(result.chunkCount()).isEqualTo(1);
                        assertThat(result.workHistoryCount()).isEqualTo(1);
                        assertThat(result.skillCount()).isEqualTo(3);
                        assertThat(result.skillsWithExperience()).isEqualTo(2);
                    })
                    .verifyComplete();

            verify(storeService).saveIngestion(any(ResumeDocument.class), eq(profile), eq(List.of(acme)),
                    anyList(), experienceCaptor.capture());
            Map<String, SkillExperience> experience = experienceCaptor.getValue();
            assertThat(experience).containsOnlyKeys("Java", "Kafka");
            assertThat(experience.get("Java").totalYears()).isEqualTo(2.0);
            assertThat(experience.get("Kafka").totalYears()).isEqualTo(1.0);

            verify(vectorIndex).replace(eq(RESUME_ID), recordsCaptor.capture());
            VectorRecord record = recordsCaptor.getValue().get(0);
            assertThat(record.id()).isEqualTo("r1_c0");
            assertThat(record.metadata()).containsEntry("company", "Acme").containsEntry("resume_id", RESUME_ID);

            assertThat(meterRegistry.counter("resume_screener_resumes_ingested_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should store an empty profile for blank text without calling any provider")
        void shouldStoreEmptyProfileForBlankText() {
            when(vectorIndex.replace(RESUME_ID, List.of())).thenReturn(Mono.just(0));

            StepVerifier.create(service.ingest(RESUME_ID, "   "))
                    .assertNext(result -> {
                        assertThat(result.chunkCount()).isZero();
                        assertThat(result.skillCount()).isZero();
                    })
                    .verifyComplete();

            verify(storeService).saveIngestion(any(ResumeDocument.class), eq(ResumeProfile.empty()), eq(List.of()),
                    eq(List.of()), eq(Map.of()));
            verify(vectorIndex).replace(RESUME_ID, List.of());
            verifyNoInteractions(extractionService, embeddingClient);
        }

        @Test
        @DisplayName("Should fail and persist nothing when embedding fails")
        void shouldFailWhenEmbeddingFails() {
            when(extractionService.extractProfile(TEXT)).thenReturn(Mono.just(ResumeProfile.empty()));
            when(extractionService.extractWorkHistory(TEXT)).thenReturn(Mono.just(List.of()));
            when(embeddingClient.embed(anyString())).thenReturn(Mono.error(new EmbeddingException("quota exceeded")));

            StepVerifier.create(service.ingest(RESUME_ID, TEXT))
                    .expectError(EmbeddingException.class)
                    .verify();

            verify(storeService, never()).saveIngestion(any(), any(), anyList(), anyList(), any());
            verify(vectorIndex, never()).replace(anyString(), anyList());
            assertThat(meterRegistry.counter("resume_screener_ingestion_failures_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep the previous index entries when re-ingestion cannot embed")
        void shouldKeepPreviousVectorsWhenEmbeddingFails() {
            InMemoryVectorIndex index = new InMemoryVectorIndex();
            index.upsert(List.of(new VectorRecord("r1_c0", RESUME_ID, new float[]{1f, 0f}, "Old Java chunk",
                    Map.of()))).block();
            ResumeIngestionService realIndexService = new ResumeIngestionService(extractionService,
                    new ChunkingService(250, 50), new ExperienceAggregationService(), embeddingClient, index,
                    storeService, new IngestionConfig(), new ScreeningMetrics(meterRegistry), clock);
            when(extractionService.extractProfile(TEXT)).thenReturn(Mono.just(ResumeProfile.empty()));
            when(extractionService.extractWorkHistory(TEXT)).thenReturn(Mono.just(List.of()));
            when(embeddingClient.embed(anyString())).thenReturn(Mono.error(new EmbeddingException("embedding down")));

            StepVerifier.create(realIndexService.ingest(RESUME_ID, TEXT))
                    .expectError(EmbeddingException.class)
                    .verify();

            StepVerifier.create(index.search(new float[]{1f, 0f}, RESUME_ID, 5))
                    .assertNext(hits -> assertThat(hits).extracting(VectorHit::id).containsExactly("r1_c0"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should leave the index untouched when the resume cannot be stored")
        void shouldNotReplaceVectorsWhenPersistenceFails() {
            when(extractionService.extractProfile(TEXT)).thenReturn(Mono.just(ResumeProfile.empty()));
            when(extractionService.extractWorkHistory(TEXT)).thenReturn(Mono.just(List.of()));
            when(embeddingClient.embed(anyString())).thenReturn(Mono.just(new float[]{1f, 0f}));
            doThrow(new IllegalStateException("database is locked")).when(storeService)
                    .saveIngestion(any(), any(), anyList(), anyList(), any());

            StepVerifier.create(service.ingest(RESUME_ID, TEXT))
                    .expectErrorMessage("database is locked")
                    .verify();

            verify(vectorIndex, never()).replace(anyString(), anyList());
        }

        @Test
        @DisplayName("Should reject a blank resume id")
        void shouldRejectBlankResumeId() {
            StepVerifier.create(service.ingest(" ", TEXT))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Should re-index stored chunks")
        void shouldReindexStoredChunks() {
            when(storeService.loadChunks(RESUME_ID)).thenReturn(List.of(
                    new Chunk("first", 0, 0, 1, 0, null),
                    new Chunk("second", 1, 1, 1, 0, null)));
            stubIndexing();

            StepVerifier.create(service.reindex(RESUME_ID))
                    .expectNext(2)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail to re-index an unknown resume")
        void shouldFailToReindexUnknownResume() {
            when(storeService.loadChunks("missing")).thenReturn(List.of());

            StepVerifier.create(service.reindex("missing"))
                    .expectError(ResumeNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should replace the skill experience map of a stored resume")
        void shouldRefreshSkillExperience() {
            StoredResume stored = new StoredResume(RESUME_ID, TEXT, profile, List.of(acme), Map.of(),
                    Instant.parse("2024-01-01T00:00:00Z"));
            when(storeService.loadResume(RESUME_ID)).thenReturn(Optional.of(stored));
            when(extractionService.extractSkillExperience(List.of("Java", "Kafka"), TEXT))
                    .thenReturn(Mono.just(Map.of("Java", List.of(OracleJobMatch.of("Acme", 30, "")))));
            when(extractionService.extractSkillExperience(List.of("Go"), TEXT)).thenReturn(Mono.just(Map.of()));

            StepVerifier.create(service.refreshSkillExperience(RESUME_ID))
                    .assertNext(map -> assertThat(map.get("Java").totalYears()).isEqualTo(2.5))
                    .verifyComplete();

            verify(storeService).replaceSkillExperience(eq(RESUME_ID), experienceCaptor.capture());
            assertThat(experienceCaptor.getValue()).containsOnlyKeys("Java");
        }
    }
}
