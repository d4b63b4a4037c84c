package dev.resumescreener.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * TextOracle backed by the Google AI Studio (Gemini) generateContent REST API.
 * Uses simple API key authentication.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "oracle.provider", havingValue = "gemini", matchIfMissing = true)
public class GeminiTextOracle implements TextOracle {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;

    public GeminiTextOracle(
            @Value("${oracle.gemini.api-key:}") String apiKey,
            @Value("${oracle.gemini.model:gemini-2.0-flash}") String model,
            @Value("${oracle.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${oracle.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Oracle calls will fail.");
        } else {
            log.info("Gemini oracle enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<String> invoke(String prompt, int maxOutputTokens) {
        if (!isEnabled()) {
            return Mono.error(new OracleException("Gemini API key is not configured"));
        }

        GeminiRequest request = buildRequest(prompt, maxOutputTokens);
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(Objects.requireNonNull(request))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .onErrorMap(WebClientResponseException.class, OracleHttpErrors::translate)
                .flatMap(response -> {
                    String text = extractContent(response);
                    if (text == null || text.isBlank()) {
                        return Mono.error(new OracleParseException("Gemini returned no content"));
                    }
                    return Mono.just(text);
                });
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getName() {
        return "gemini";
    }

    private GeminiRequest buildRequest(String prompt, int maxOutputTokens) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.0, maxOutputTokens));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates or null response");
            return null;
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            log.warn("Gemini candidate has no content parts. Finish reason: {}", candidate.finishReason());
            return null;
        }

        StringBuilder text = new StringBuilder();
        for (var part : candidate.content().parts()) {
            if (part.text() != null) {
                text.append(part.text());
            }
        }
        return text.toString();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
