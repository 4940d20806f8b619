package br.edu.ifba.journal.nlu;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.Turn;

/**
 * One way of reading entities, emotions, relationships and intent out of text.
 *
 * <p>{@link FactExtractor} asks each strategy whether it is available before calling it, so a
 * strategy whose backing service is known to be down is skipped without paying for a call.</p>
 *
 * @see GenerativeExtractionStrategy
 * @see LexicalEntityTagger
 */
public interface ExtractionStrategy {

    /**
     * Short name recorded on every fact this strategy produces.
     */
    @NotNull
    String name();

    /**
     * Cheap, non-blocking check of whether a call is worth making right now.
     */
    boolean isAvailable();

    /**
     * Reads the text. A failed future means this strategy could not produce a valid reading.
     *
     * @param text the text to read
     * @param recentHistory the latest turns of the conversation, oldest first; may be empty
     */
    @NotNull
    CompletableFuture<ExtractedFact> extract(@NotNull String text, @NotNull List<Turn> recentHistory);
}
