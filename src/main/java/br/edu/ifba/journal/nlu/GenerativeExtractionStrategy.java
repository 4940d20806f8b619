package br.edu.ifba.journal.nlu;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.exception.SchemaValidationException;
import br.edu.ifba.journal.llm.LLMFunction;
import br.edu.ifba.journal.utils.RetryEventLogger;

/**
 * Extraction through one JSON-mode LLM call.
 *
 * <p>An answer that fails validation gets exactly one more call with a stricter instruction naming
 * the problems. If that answer is rejected too, the returned future fails with
 * {@link SchemaValidationException}. Transport failures are not retried here.</p>
 */
public class GenerativeExtractionStrategy implements ExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(GenerativeExtractionStrategy.class);

    public static final String NAME = "generative";

    static final double TEMPERATURE = 0.2;
    static final int MAX_OUTPUT_TOKENS = 800;
    private static final String OPERATION = "nlu.extract";

    private final LLMFunction llmFunction;
    private final ExtractionResponseParser parser;
    private final BooleanSupplier availability;
    private final int maxInputChars;
    private final int historyTurns;
    private final RetryEventLogger retryEventLogger;

    /**
     * @param llmFunction the completion function
     * @param parser recovers and validates the JSON answer
     * @param availability reports whether the model is currently reachable
     * @param maxInputChars input is truncated to this many characters
     * @param historyTurns how many of the latest turns are quoted as context
     */
    public GenerativeExtractionStrategy(
        @NotNull LLMFunction llmFunction,
        @NotNull ExtractionResponseParser parser,
        @NotNull BooleanSupplier availability,
        int maxInputChars,
        int historyTurns,
        @NotNull RetryEventLogger retryEventLogger
    ) {
        this.llmFunction = llmFunction;
        this.parser = parser;
        this.availability = availability;
        this.maxInputChars = maxInputChars;
        this.historyTurns = historyTurns;
        this.retryEventLogger = retryEventLogger;
    }

    @Override
    @NotNull
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return availability.getAsBoolean();
    }

    @Override
    @NotNull
    public CompletableFuture<ExtractedFact> extract(@NotNull String text, @NotNull List<Turn> recentHistory) {
        String input = text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
        List<Turn> history = recentHistory.size() > historyTurns
            ? recentHistory.subList(recentHistory.size() - historyTurns, recentHistory.size())
            : recentHistory;

        String prompt = ExtractionPrompts.userPrompt(input, history);

        return call(prompt).thenCompose(raw -> {
            try {
                return CompletableFuture.completedFuture(parser.parse(raw, NAME));
            } catch (SchemaValidationException first) {
                retryEventLogger.logRetryAttempt(OPERATION, 2, 2, first);
                return call(ExtractionPrompts.strictPrompt(prompt, first.getProblems()))
                    .thenApply(this::parseRetried);
            }
        });
    }

    private ExtractedFact parseRetried(String raw) {
        try {
            ExtractedFact fact = parser.parse(raw, NAME);
            retryEventLogger.logRetrySuccess(OPERATION, 2);
            return fact;
        } catch (SchemaValidationException second) {
            retryEventLogger.logRetryExhausted(OPERATION, 2, second);
            throw new CompletionException(second);
        }
    }

    private CompletableFuture<String> call(String prompt) {
        logger.debug("Requesting extraction for {} characters", prompt.length());
        return llmFunction.apply(
            prompt,
            ExtractionPrompts.SYSTEM_PROMPT,
            null,
            Map.of(
                LLMFunction.TEMPERATURE, TEMPERATURE,
                LLMFunction.MAX_TOKENS, MAX_OUTPUT_TOKENS,
                LLMFunction.RESPONSE_FORMAT, "json"
            )
        );
    }
}
