package dev.resumescreener.service;

import dev.resumescreener.config.RetrievalConfig;
import dev.resumescreener.embedding.EmbeddingClient;
import dev.resumescreener.embedding.EmbeddingException;
import dev.resumescreener.model.EvidenceGrade;
import dev.resumescreener.model.EvidenceStatus;
import dev.resumescreener.model.EvidenceStrength;
import dev.resumescreener.model.Importance;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.RankedCandidate;
import dev.resumescreener.model.VectorHit;
import dev.resumescreener.vector.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvidenceRetrievalServiceTest {

    @Mock
    private EmbeddingClient embeddingClient;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private OracleExtractionService extractionService;

    private EvidenceRetrievalService service;

    private static final float[] QUERY_VECTOR = {0.1f, 0.2f, 0.3f};

    @BeforeEach
    void setUp() {
        service = new EvidenceRetrievalService(embeddingClient, vectorIndex, extractionService, new RetrievalConfig());
    }

    private static VectorHit hit(String id, double similarity, String text) {
        return new VectorHit(id, similarity, text, Map.of("resume_id", "r1"));
    }

    @Nested
    @DisplayName("Re-ranking")
    class RerankTests {

        @Test
        @DisplayName("Should prefer a keyword hit over a slightly more similar chunk")
        void shouldBoostKeywordHit() {
            List<RankedCandidate> ranked = service.rerank("Kubernetes", List.of(
                    hit("r1_c0", 0.80, "Led a Java team of five engineers"),
                    hit("r1_c1", 0.75, "Deployed services on Kubernetes clusters")));

            assertThat(ranked.get(0).hit().id()).isEqualTo("r1_c1");
            assertThat(ranked.get(0).boostedScore()).isCloseTo(1.125, within(1e-9));
            assertThat(ranked.get(0).keywordHit()).isTrue();
            assertThat(ranked.get(1).boostedScore()).isCloseTo(0.80, within(1e-9));
        }

        @Test
        @DisplayName("Should match the keyword case-insensitively")
        void shouldMatchKeywordIgnoringCase() {
            List<RankedCandidate> ranked = service.rerank("postgresql", List.of(hit("r1_c3", 0.5, "Tuned PostgreSQL")));

            assertThat(ranked.get(0).keywordHit()).isTrue();
            assertThat(ranked.get(0).boostedScore()).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("Should keep the original order for equal boosted scores")
        void shouldBreakTiesByOriginalRank() {
            VectorHit plain = hit("plain", 0.75, "Backend services");
            VectorHit keyword = hit("keyword", 0.5, "Some Kafka consumers");

            assertThat(service.rerank("Kafka", List.of(plain, keyword)))
                    .extracting(c -> c.hit().id()).containsExactly("plain", "keyword");
            assertThat(service.rerank("Kafka", List.of(keyword, plain)))
                    .extracting(c -> c.hit().id()).containsExactly("keyword", "plain");
        }

        @Test
        @DisplayName("Should return an empty ranking for no hits")
        void shouldReturnEmptyForNoHits() {
            assertThat(service.rerank("Java", List.of())).isEmpty();
            assertThat(service.rerank("Java", null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Retrieve")
    class RetrieveTests {

        private final JobRequirement kubernetes = JobRequirement.builder()
                .skillName("Kubernetes").importance(Importance.REQUIRED).minYears(2).build();

        @Test
        @DisplayName("Should grade the best re-ranked chunk")
        void shouldGradeBestChunk() {
            when(embeddingClient.embed("Experience with Kubernetes skill")).thenReturn(Mono.just(QUERY_VECTOR));
            when(vectorIndex.search(QUERY_VECTOR, "r1", 5)).thenReturn(Mono.just(List.of(
                    hit("r1_c0", 0.80, "Led a Java team"),
                    hit("r1_c1", 0.75, "Deployed services on Kubernetes"))));
            when(extractionService.gradeEvidence("Kubernetes", 2.0, "Deployed services on Kubernetes"))
                    .thenReturn(Mono.just(new EvidenceGrade(true, EvidenceStrength.STRONG,
                            "Deployed services on Kubernetes", "Direct hands-on use", 0.9)));

            StepVerifier.create(service.retrieve(kubernetes, "r1", 5))
                    .assertNext(match -> {
                        assertThat(match.chunkId()).isEqualTo("r1_c1");
                        assertThat(match.relevanceScore()).isCloseTo(1.125, within(1e-9));
                        assertThat(match.matched()).isTrue();
                        assertThat(match.strength()).isEqualTo(EvidenceStrength.STRONG);
                        assertThat(match.status()).isEqualTo(EvidenceStatus.GRADED);
                        assertThat(match.reasoning()).isEqualTo("Direct hands-on use");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return the no-evidence sentinel without calling the oracle when nothing is indexed")
        void shouldReturnSentinelForEmptyIndex() {
            when(embeddingClient.embed(anyString())).thenReturn(Mono.just(QUERY_VECTOR));
            when(vectorIndex.search(any(), eq("r1"), eq(5))).thenReturn(Mono.just(List.of()));

            StepVerifier.create(service.retrieve(kubernetes, "r1", 5))
                    .assertNext(match -> {
                        assertThat(match.matched()).isFalse();
                        assertThat(match.strength()).isEqualTo(EvidenceStrength.NONE);
                        assertThat(match.status()).isEqualTo(EvidenceStatus.NO_EVIDENCE_FOUND);
                        assertThat(match.chunkId()).isNull();
                    })
                    .verifyComplete();

            verifyNoInteractions(extractionService);
        }

        @Test
        @DisplayName("Should grade the next-ranked chunk when the best one has no text")
        void shouldSkipBlankTopChunk() {
            when(embeddingClient.embed(anyString())).thenReturn(Mono.just(QUERY_VECTOR));
            when(vectorIndex.search(any(), anyString(), anyInt())).thenReturn(Mono.just(List.of(
                    hit("r1_c0", 0.95, "  "),
                    hit("r1_c1", 0.60, "Ran batch jobs on a shared cluster"))));
            when(extractionService.gradeEvidence("Kubernetes", 2.0, "Ran batch jobs on a shared cluster"))
                    .thenReturn(Mono.just(new EvidenceGrade(true, EvidenceStrength.WEAK,
                            "shared cluster", "Cluster work without naming Kubernetes", 0.4)));

            StepVerifier.create(service.retrieve(kubernetes, "r1", 5))
                    .assertNext(match -> {
                        assertThat(match.chunkId()).isEqualTo("r1_c1");
                        assertThat(match.relevanceScore()).isCloseTo(0.60, within(1e-9));
                        assertThat(match.strength()).isEqualTo(EvidenceStrength.WEAK);
                        assertThat(match.status()).isEqualTo(EvidenceStatus.GRADED);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return the sentinel when no candidate chunk has text")
        void shouldReturnSentinelForBlankChunk() {
            when(embeddingClient.embed(anyString())).thenReturn(Mono.just(QUERY_VECTOR));
            when(vectorIndex.search(any(), anyString(), anyInt())).thenReturn(Mono.just(List.of(hit("r1_c0", 0.9, " "))));

            StepVerifier.create(service.retrieve("Kubernetes", "r1", 5))
                    .assertNext(match -> assertThat(match.status()).isEqualTo(EvidenceStatus.NO_EVIDENCE_FOUND))
                    .verifyComplete();

            verify(extractionService, never()).gradeEvidence(anyString(), anyDouble(), anyString());
        }

        @Test
        @DisplayName("Should propagate embedding failures")
        void shouldPropagateEmbeddingFailure() {
            when(embeddingClient.embed(anyString())).thenReturn(Mono.error(new EmbeddingException("quota")));

            StepVerifier.create(service.retrieve(kubernetes, "r1", 5))
                    .expectError(EmbeddingException.class)
                    .verify();

            verifyNoInteractions(vectorIndex);
        }

        @Test
        @DisplayName("Should reject a blank skill and a non-positive k")
        void shouldRejectInvalidArguments() {
            StepVerifier.create(service.retrieve(" ", "r1", 5))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(service.retrieve(kubernetes, "r1", 0))
                    .expectError(IllegalArgumentException.class)
                    .verify();

            verifyNoInteractions(embeddingClient);
        }
    }
}
