package dev.resumescreener.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.resumescreener.ai.OracleRetryPolicy;
import dev.resumescreener.config.EmbeddingConfig;
import dev.resumescreener.metrics.ScreeningMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * EmbeddingClient backed by the Gemini embedContent REST API.
 */
@Slf4j
@Service
public class GeminiEmbeddingClient implements EmbeddingClient {

    private static final String EMBED_PATH = "/v1beta/models/%s:embedContent";

    private final WebClient webClient;
    private final EmbeddingConfig config;
    private final ScreeningMetrics metrics;
    private final OracleRetryPolicy retryPolicy;

    public GeminiEmbeddingClient(EmbeddingConfig config, ScreeningMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        this.retryPolicy = new OracleRetryPolicy(config.getMaxAttempts(), config.getInitialBackoff(),
                GeminiEmbeddingClient::isRetryableError);
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(config.getBaseUrl()))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("Embedding API Key is missing! Chunk indexing and retrieval will fail.");
        } else {
            log.info("Gemini embeddings enabled with model: {}", config.getModel());
        }
    }

    @Override
    public Mono<float[]> embed(String text) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            return Mono.error(new EmbeddingException("Embedding API key is not configured"));
        }
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("Cannot embed blank text"));
        }

        String input = text.length() > config.getMaxInputChars()
                ? text.substring(0, config.getMaxInputChars())
                : text;
        EmbedRequest request = new EmbedRequest("models/" + config.getModel(),
                new EmbedRequest.Content(List.of(new EmbedRequest.Part(input))));
        String uri = String.format(EMBED_PATH, config.getModel()) + "?key=" + config.getApiKey();

        return Mono.defer(() -> {
                    metrics.recordEmbeddingCall();
                    return webClient.post()
                            .uri(uri)
                            .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                            .bodyValue(request)
                            .retrieve()
                            .bodyToMono(EmbedResponse.class);
                })
                .timeout(config.getTimeout())
                .retryWhen(retryPolicy.toRetry("embedding"))
                .flatMap(this::toVector)
                .onErrorMap(e -> !(e instanceof EmbeddingException), e -> {
                    metrics.recordEmbeddingError();
                    return new EmbeddingException("Embedding failed: " + e.getMessage(), e);
                });
    }

    private Mono<float[]> toVector(EmbedResponse response) {
        if (response == null || response.embedding() == null || response.embedding().values() == null
                || response.embedding().values().isEmpty()) {
            metrics.recordEmbeddingError();
            return Mono.error(new EmbeddingException("Embedding response has no values"));
        }
        List<Double> values = response.embedding().values();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return Mono.just(vector);
    }

    private static boolean isRetryableError(Throwable e) {
        if (e instanceof TimeoutException) {
            return true;
        }
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    record EmbedRequest(String model, Content content) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbedResponse(Values embedding) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Values(List<Double> values) {
        }
    }
}
