package dev.resumescreener.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.resumescreener.ai.dto.OracleResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw completion text into a validated response type.
 * Tolerates markdown fences and prose around the JSON value; anything else is a parse error.
 */
@Slf4j
@Component
public class OracleResponseParser {

    private final ObjectMapper objectMapper;

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public <T extends OracleResponse> T parse(String raw, Class<T> type) {
        String json = extractJson(raw);
        T value;
        try {
            value = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new OracleParseException("Invalid " + type.getSimpleName() + " JSON: " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new OracleParseException("Empty " + type.getSimpleName() + " JSON");
        }
        value.validate();
        return value;
    }

    /**
     * Cut the first JSON object or array out of the completion.
     */
    static String extractJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new OracleParseException("Oracle returned an empty completion");
        }
        String text = stripFences(raw.trim());

        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        boolean isArray = arrayStart != -1 && (objectStart == -1 || arrayStart < objectStart);
        int start = isArray ? arrayStart : objectStart;
        int end = isArray ? text.lastIndexOf(']') : text.lastIndexOf('}');
        if (start == -1 || end == -1 || end < start) {
            throw new OracleParseException("No JSON found in completion: " + preview(text));
        }

        String json = text.substring(start, end + 1);
        if (!isArray) {
            int concatenated = json.indexOf("}{");
            if (concatenated != -1) {
                log.warn("Oracle returned several JSON objects, keeping the first");
                json = json.substring(0, concatenated + 1);
            }
        }
        return json;
    }

    private static String stripFences(String text) {
        String result = text;
        if (result.startsWith("```json")) {
            result = result.substring(7);
        } else if (result.startsWith("```")) {
            result = result.substring(3);
        }
        if (result.endsWith("```")) {
            result = result.substring(0, result.length() - 3);
        }
        return result.trim();
    }

    static String preview(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() > 120 ? flat.substring(0, 120) + "..." : flat;
    }
}
