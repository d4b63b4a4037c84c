package dev.resumescreener.vector;

import dev.resumescreener.model.VectorHit;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Similarity-search store for resume chunks. Results are best-effort by similarity;
 * callers must not rely on any stricter order.
 */
public interface VectorIndex {

    /**
     * Insert or replace records by id.
     */
    Mono<Void> upsert(List<VectorRecord> records);

    /**
     * Top {@code k} chunks of one resume by similarity to {@code query}.
     */
    Mono<List<VectorHit>> search(float[] query, String resumeId, int k);

    /**
     * Swap all records of one resume for {@code records} in a single step. Searches see
     * either the old set or the new one, never a mix or an empty gap.
     *
     * @return number of records now held for the resume
     */
    Mono<Integer> replace(String resumeId, List<VectorRecord> records);

    /**
     * @return number of records removed
     */
    Mono<Integer> deleteByResumeId(String resumeId);
}
