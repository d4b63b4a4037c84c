package dev.resumescreener.vector;

import dev.resumescreener.model.VectorHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact cosine-similarity index held in memory, partitioned by resume id.
 */
@Slf4j
@Component
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, Map<String, VectorRecord>> byResume = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> upsert(List<VectorRecord> records) {
        return Mono.fromRunnable(() -> {
            for (VectorRecord rec : records) {
                byResume.computeIfAbsent(rec.resumeId(), id -> new ConcurrentHashMap<>()).put(rec.id(), rec);
            }
            log.debug("Upserted {} vectors", records.size());
        });
    }

    @Override
    public Mono<Integer> replace(String resumeId, List<VectorRecord> records) {
        return Mono.fromCallable(() -> {
            Map<String, VectorRecord> replacement = new ConcurrentHashMap<>();
            for (VectorRecord rec : records) {
                if (!resumeId.equals(rec.resumeId())) {
                    throw new IllegalArgumentException("Record " + rec.id() + " belongs to resume " + rec.resumeId()
                            + ", not " + resumeId);
                }
                replacement.put(rec.id(), rec);
            }
            Map<String, VectorRecord> previous = byResume.put(resumeId, replacement);
            log.debug("Replaced {} vectors of resume {} with {}", previous == null ? 0 : previous.size(), resumeId,
                    replacement.size());
            return replacement.size();
        });
    }

    @Override
    public Mono<List<VectorHit>> search(float[] query, String resumeId, int k) {
        if (k <= 0) {
            return Mono.error(new IllegalArgumentException("k must be positive, got " + k));
        }
        return Mono.fromCallable(() -> {
            Map<String, VectorRecord> records = byResume.getOrDefault(resumeId, Map.of());
            return records.values().stream()
                    .map(rec -> new VectorHit(rec.id(), cosine(query, rec.vector()), rec.chunkText(), rec.metadata()))
                    .sorted(Comparator.comparingDouble(VectorHit::similarity).reversed()
                            .thenComparing(VectorHit::id))
                    .limit(k)
                    .toList();
        });
    }

    @Override
    public Mono<Integer> deleteByResumeId(String resumeId) {
        return Mono.fromCallable(() -> {
            Map<String, VectorRecord> removed = byResume.remove(resumeId);
            return removed == null ? 0 : removed.size();
        });
    }

    /**
     * Cosine similarity clamped to [0, 1]; mismatched or zero vectors score 0.
     */
    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double sim = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, Math.min(1.0, sim));
    }
}
