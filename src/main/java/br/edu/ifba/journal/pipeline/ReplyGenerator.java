package br.edu.ifba.journal.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.exception.DependencyUnavailableException;
import br.edu.ifba.journal.llm.LLMFunction;
import br.edu.ifba.journal.utils.RetryEventLogger;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Calls the generation model for one reply, retrying a failed call after a fixed delay.
 *
 * <p>Only the last {@code historyTurns} turns of the session are sent. A blank completion counts
 * as a reply; judging it is left to the format check.</p>
 */
public class ReplyGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ReplyGenerator.class);

    static final String OPERATION = "reply.generate";

    // only schedules the next attempt; the calls themselves run on the model client's threads
    private static final ScheduledExecutorService RETRY_SCHEDULER = Executors.newSingleThreadScheduledExecutor(task -> {
        Thread thread = new Thread(task, "reply-retry");
        thread.setDaemon(true);
        return thread;
    });

    private final LLMFunction llmFunction;
    private final int maxTokens;
    private final double temperature;
    private final int historyTurns;
    private final int maxAttempts;
    private final Retry retry;

    public ReplyGenerator(
        @NotNull LLMFunction llmFunction,
        @NotNull RetryEventLogger retryEventLogger,
        int maxTokens,
        double temperature,
        int historyTurns,
        int maxRetries,
        long retryDelayMs
    ) {
        this.llmFunction = llmFunction;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.historyTurns = historyTurns;
        this.maxAttempts = Math.max(0, maxRetries) + 1;
        // async retries stop on a wait below one millisecond
        this.retry = Retry.of(OPERATION, RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(Duration.ofMillis(Math.max(1, retryDelayMs)))
            .build());

        retry.getEventPublisher()
            .onRetry(event -> retryEventLogger.logRetryAttempt(
                OPERATION, event.getNumberOfRetryAttempts(), maxAttempts, unwrap(event.getLastThrowable())))
            .onSuccess(event -> retryEventLogger.logRetrySuccess(OPERATION, event.getNumberOfRetryAttempts() + 1))
            .onError(event -> retryEventLogger.logRetryExhausted(
                OPERATION, event.getNumberOfRetryAttempts(), unwrap(event.getLastThrowable())));
    }

    /**
     * @return future with the generated text; fails with {@link DependencyUnavailableException}
     *         once every attempt failed
     */
    @NotNull
    public CompletableFuture<String> generate(@NotNull String prompt, @NotNull String systemPrompt, @NotNull List<Turn> history) {
        List<LLMFunction.Message> messages = LLMFunction.Message.fromTurns(recent(history, historyTurns));
        Map<String, Object> kwargs = Map.of(
            LLMFunction.MAX_TOKENS, maxTokens,
            LLMFunction.TEMPERATURE, temperature);

        Supplier<CompletionStage<String>> call = () -> {
            try {
                return llmFunction.apply(prompt, systemPrompt, messages, kwargs);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };

        return Retry.decorateCompletionStage(retry, RETRY_SCHEDULER, call).get()
            .toCompletableFuture()
            .handle((reply, error) -> {
                if (error != null) {
                    throw new DependencyUnavailableException(
                        "generation", "Reply generation failed after " + maxAttempts + " attempts", unwrap(error));
                }
                return reply == null ? "" : reply.strip();
            });
    }

    static List<Turn> recent(List<Turn> history, int limit) {
        if (history.size() <= limit) {
            return history;
        }
        logger.debug("Trimming history from {} to {} turns", history.size(), limit);
        return history.subList(history.size() - limit, history.size());
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
