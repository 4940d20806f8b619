package br.edu.ifba.journal.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.journal.core.Turn;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Black-box text completion.
 *
 * <p>Implementations are unreliable by nature: they may time out or be rate limited. Callers
 * treat every invocation as best-effort and handle a failed future.</p>
 *
 * <p>Recognised {@code kwargs}: {@code max_tokens} (Integer), {@code temperature} (Double),
 * {@code model} (String), {@code response_format} (String, {@code "json"}).</p>
 */
@FunctionalInterface
public interface LLMFunction {

    String MAX_TOKENS = "max_tokens";
    String TEMPERATURE = "temperature";
    String RESPONSE_FORMAT = "response_format";

    /**
     * Completes a prompt.
     *
     * @param prompt the user prompt
     * @param systemPrompt optional system instruction
     * @param historyMessages optional prior conversation, oldest first
     * @param kwargs generation parameters
     * @return future completing with the generated text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @Nullable List<Message> historyMessages,
        @NotNull Map<String, Object> kwargs
    );

    default CompletableFuture<String> apply(@NotNull String prompt) {
        return apply(prompt, null, null, Map.of());
    }

    default CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt
    ) {
        return apply(prompt, systemPrompt, null, Map.of());
    }

    /**
     * Chat message passed as conversation history.
     */
    record Message(
        @NotNull Role role,
        @NotNull String content
    ) {
        public enum Role {
            SYSTEM, USER, ASSISTANT
        }

        /**
         * Converts session turns to history messages.
         */
        @NotNull
        public static List<Message> fromTurns(@NotNull List<Turn> turns) {
            List<Message> messages = new ArrayList<>(turns.size());
            for (Turn turn : turns) {
                Role role = turn.speaker() == Turn.Speaker.USER ? Role.USER : Role.ASSISTANT;
                messages.add(new Message(role, turn.content()));
            }
            return messages;
        }
    }
}
