package dev.resumescreener.embedding;

import reactor.core.publisher.Mono;

/**
 * Turns text into a fixed-dimension vector for similarity search.
 */
public interface EmbeddingClient {

    /**
     * @param text text to embed; implementations may truncate long input
     * @return Mono with the embedding, failing with {@link EmbeddingException}
     */
    Mono<float[]> embed(String text);
}
