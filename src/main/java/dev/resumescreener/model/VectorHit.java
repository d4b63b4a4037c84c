package dev.resumescreener.model;

import java.util.Map;

/**
 * One result of a similarity search.
 */
public record VectorHit(String id, double similarity, String chunkText, Map<String, String> metadata) {

    public VectorHit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
