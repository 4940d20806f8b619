package br.edu.ifba.journal.client;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OpenAI-compatible chat completion request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LlmChatRequest(
    String model,
    List<ChatMessage> messages,

    @JsonProperty("max_tokens")
    Integer maxTokens,

    Double temperature,

    /**
     * {@code {"type": "json_object"}} when the caller expects a JSON document back.
     */
    @JsonProperty("response_format")
    Map<String, String> responseFormat
) {

    private static final Map<String, String> JSON_OBJECT = Map.of("type", "json_object");

    public static LlmChatRequest of(
            final String model,
            final List<ChatMessage> messages,
            final Integer maxTokens,
            final Double temperature,
            final boolean jsonResponse) {
        return new LlmChatRequest(model, messages, maxTokens, temperature, jsonResponse ? JSON_OBJECT : null);
    }
}
