package dev.resumescreener.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * TextOracle backed by OpenRouter.
 * OpenRouter exposes many models (Gemini, Claude, Llama) through an OpenAI-compatible API.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "oracle.provider", havingValue = "openrouter")
public class OpenRouterTextOracle implements TextOracle {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;

    public OpenRouterTextOracle(
            @Value("${oracle.openrouter.api-key:}") String apiKey,
            @Value("${oracle.openrouter.model:google/gemini-2.0-flash-001}") String model,
            @Value("${oracle.openrouter.base-url:https://openrouter.ai/api/v1}") String baseUrl) {

        this.apiKey = apiKey;
        this.model = model;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("X-Title", "Resume Screener")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenRouter API Key is missing! Oracle calls will fail.");
        } else {
            log.info("OpenRouter oracle enabled with model: {}", this.model);
        }
    }

    @Override
    public Mono<String> invoke(String prompt, int maxOutputTokens) {
        if (!isEnabled()) {
            return Mono.error(new OracleException("OpenRouter API key is not configured"));
        }

        OpenRouterRequest request = new OpenRouterRequest(
                model,
                List.of(new OpenRouterRequest.Message("user", prompt)),
                0.0,
                maxOutputTokens);

        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(Objects.requireNonNull(request))
                .retrieve()
                .bodyToMono(OpenRouterResponse.class)
                .onErrorMap(WebClientResponseException.class, OracleHttpErrors::translate)
                .flatMap(response -> {
                    String text = extractContent(response);
                    if (text == null || text.isBlank()) {
                        return Mono.error(new OracleParseException("OpenRouter returned no content"));
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
        return "openrouter";
    }

    private String extractContent(OpenRouterResponse response) {
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            log.warn("OpenRouter returned no choices");
            return null;
        }
        var message = response.choices().get(0).message();
        return message != null ? message.content() : null;
    }

    record OpenRouterRequest(
            String model,
            List<Message> messages,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OpenRouterResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
