package dev.resumescreener.vector;

import java.util.Map;

/**
 * One chunk embedding as stored in the vector index.
 */
public record VectorRecord(String id, String resumeId, float[] vector, String chunkText, Map<String, String> metadata) {
    public VectorRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
