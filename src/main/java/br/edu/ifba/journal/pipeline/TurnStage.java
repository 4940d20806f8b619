package br.edu.ifba.journal.pipeline;

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * One step of the turn pipeline.
 *
 * <p>Stages read what earlier stages left in the {@link TurnContext} and write their own outputs
 * back. A stage records a degraded dependency in the context instead of failing the future; a
 * failed future ends the turn with the static apology.</p>
 */
public interface TurnStage {

    CompletableFuture<TurnContext> process(@NotNull TurnContext context);

    /**
     * @return stage name for logs, e.g. "retrieve"
     */
    String getName();

    /**
     * Default: a stage runs unless the turn already finished.
     */
    default boolean shouldSkip(@NotNull TurnContext context) {
        return context.getState().isTerminal();
    }
}
