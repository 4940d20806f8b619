package br.edu.ifba.journal.nlu;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.Turn;

/**
 * Reads a piece of text with the first strategy that is available and succeeds.
 *
 * <p>Strategies are tried in order. One that reports itself unavailable is skipped; one that
 * fails, times out or returns an invalid answer hands over to the next. The returned future never
 * completes exceptionally: when every strategy fails the result is {@link ExtractedFact#empty()}.</p>
 *
 * <pre>{@code
 * FactExtractor extractor = new FactExtractor(
 *     List.of(generativeStrategy, new LexicalEntityTagger()), 8000);
 * ExtractedFact fact = extractor.extract("Lunch with Ana at Acme Corp", history);
 * }</pre>
 */
public class FactExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FactExtractor.class);

    private final List<ExtractionStrategy> strategies;
    private final long timeoutMs;

    /**
     * @param strategies preferred strategy first, offline fallback last
     * @param timeoutMs per-strategy time limit
     */
    public FactExtractor(@NotNull List<ExtractionStrategy> strategies, long timeoutMs) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.timeoutMs = timeoutMs;
    }

    /**
     * Blocking form of {@link #extractAsync(String, List)}. Never throws.
     */
    @NotNull
    public ExtractedFact extract(@NotNull String text, @NotNull List<Turn> recentHistory) {
        return extractAsync(text, recentHistory).join();
    }

    @NotNull
    public CompletableFuture<ExtractedFact> extractAsync(@NotNull String text, @NotNull List<Turn> recentHistory) {
        if (text.isBlank()) {
            return CompletableFuture.completedFuture(ExtractedFact.empty());
        }
        return attempt(0, text, recentHistory);
    }

    private CompletableFuture<ExtractedFact> attempt(int index, String text, List<Turn> history) {
        if (index >= strategies.size()) {
            logger.warn("No extraction strategy succeeded, using empty reading");
            return CompletableFuture.completedFuture(ExtractedFact.empty());
        }

        ExtractionStrategy strategy = strategies.get(index);
        if (!strategy.isAvailable()) {
            logger.debug("Extraction strategy '{}' unavailable, skipping", strategy.name());
            return attempt(index + 1, text, history);
        }

        CompletableFuture<ExtractedFact> call;
        try {
            // copy so the timeout does not complete the strategy's own future
            call = strategy.extract(text, history).copy().orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        return call.handle((fact, error) -> {
            if (error == null && fact != null) {
                logger.debug("Extraction by '{}': {} entities, {} emotions, intent {}",
                    strategy.name(), fact.entities().size(), fact.emotions().size(), fact.intent().label());
                return CompletableFuture.completedFuture(fact);
            }
            Throwable cause = unwrap(error);
            logger.warn("Extraction strategy '{}' failed, falling back: {}", strategy.name(),
                cause == null ? "no result" : cause.getClass().getSimpleName() + " - " + cause.getMessage());
            return attempt(index + 1, text, history);
        }).thenCompose(next -> next);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
