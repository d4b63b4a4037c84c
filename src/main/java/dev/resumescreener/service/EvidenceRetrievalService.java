package dev.resumescreener.service;

import dev.resumescreener.config.RetrievalConfig;
import dev.resumescreener.embedding.EmbeddingClient;
import dev.resumescreener.model.EvidenceMatch;
import dev.resumescreener.model.EvidenceStatus;
import dev.resumescreener.model.JobRequirement;
import dev.resumescreener.model.RankedCandidate;
import dev.resumescreener.model.VectorHit;
import dev.resumescreener.vector.VectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Hybrid evidence retrieval: semantic search over a resume's chunks, re-ranked with an
 * exact-keyword boost, then the best chunk graded by the oracle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvidenceRetrievalService {

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final OracleExtractionService extractionService;
    private final RetrievalConfig config;

    /**
     * Best graded evidence for one requirement.
     * An empty search result yields {@link EvidenceMatch#noEvidence(String)}, never an error.
     */
    public Mono<EvidenceMatch> retrieve(JobRequirement requirement, String resumeId, int k) {
        String skillName = requirement.getSkillName();
        return findBest(skillName, resumeId, k)
                .flatMap(best -> grade(requirement, best))
                .defaultIfEmpty(EvidenceMatch.noEvidence(skillName));
    }

    public Mono<EvidenceMatch> retrieve(String skillName, String resumeId, int k) {
        return retrieve(JobRequirement.builder().skillName(skillName).build(), resumeId, k);
    }

    /**
     * Highest re-ranked candidate with non-blank text, or empty when the index has nothing
     * usable for the resume.
     */
    public Mono<RankedCandidate> findBest(String skillName, String resumeId, int k) {
        if (skillName == null || skillName.isBlank()) {
            return Mono.error(new IllegalArgumentException("Skill name must not be blank"));
        }
        if (k <= 0) {
            return Mono.error(new IllegalArgumentException("k must be positive, got " + k));
        }
        String query = String.format(config.getQueryTemplate(), skillName);
        return embeddingClient.embed(query)
                .flatMap(vector -> vectorIndex.search(vector, resumeId, k))
                .flatMap(hits -> {
                    List<RankedCandidate> ranked = rerank(skillName, hits);
                    if (ranked.isEmpty()) {
                        log.info("No indexed chunks for resume {} when searching '{}'", resumeId, skillName);
                        return Mono.empty();
                    }
                    RankedCandidate top = ranked.stream()
                            .filter(candidate -> hasText(candidate.hit()))
                            .findFirst()
                            .orElse(null);
                    if (top == null) {
                        log.warn("No chunk with text among {} candidates for '{}'", ranked.size(), skillName);
                        return Mono.empty();
                    }
                    log.debug("'{}' best chunk {} (raw {} -> boosted {}, keyword={})", skillName, top.hit().id(),
                            top.hit().similarity(), top.boostedScore(), top.keywordHit());
                    return Mono.just(top);
                });
    }

    /**
     * Multiply the similarity of hits that contain the skill name literally by the keyword boost,
     * then sort by boosted score; equal scores keep the index's original order.
     */
    public List<RankedCandidate> rerank(String skillName, List<VectorHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return List.of();
        }
        String needle = skillName.trim().toLowerCase(Locale.ROOT);
        List<RankedCandidate> ranked = new ArrayList<>(hits.size());
        for (int rank = 0; rank < hits.size(); rank++) {
            VectorHit hit = hits.get(rank);
            String text = hit.chunkText() == null ? "" : hit.chunkText().toLowerCase(Locale.ROOT);
            boolean keywordHit = !needle.isEmpty() && text.contains(needle);
            double boosted = keywordHit ? hit.similarity() * config.getKeywordBoost() : hit.similarity();
            ranked.add(new RankedCandidate(hit, rank, boosted, keywordHit));
        }
        ranked.sort(Comparator.comparingDouble(RankedCandidate::boostedScore).reversed()
                .thenComparingInt(RankedCandidate::originalRank));
        return ranked;
    }

    private static boolean hasText(VectorHit hit) {
        return hit.chunkText() != null && !hit.chunkText().isBlank();
    }

    private Mono<EvidenceMatch> grade(JobRequirement requirement, RankedCandidate best) {
        VectorHit hit = best.hit();
        return extractionService.gradeEvidence(requirement.getSkillName(), requirement.getMinYears(), hit.chunkText())
                .map(grade -> new EvidenceMatch(
                        requirement.getSkillName(),
                        hit.id(),
                        hit.chunkText(),
                        best.boostedScore(),
                        grade.matched(),
                        grade.strength(),
                        grade.quote(),
                        grade.reasoning(),
                        EvidenceStatus.GRADED));
    }
}
