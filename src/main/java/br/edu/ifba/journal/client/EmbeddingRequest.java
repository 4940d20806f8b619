package br.edu.ifba.journal.client;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * OpenAI-compatible embedding request. Texts are always sent as a list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmbeddingRequest(
    String model,
    List<String> input
) {
}
