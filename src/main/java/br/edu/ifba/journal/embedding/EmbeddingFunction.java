package br.edu.ifba.journal.embedding;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Turns text into fixed-length vectors.
 *
 * <p>Every vector is tagged with {@link #modelVersion()} when stored. Write time and query time
 * must use the same version or similarity scores are meaningless.</p>
 */
public interface EmbeddingFunction {

    /**
     * Embeds a batch of texts.
     *
     * @param texts texts to embed
     * @return future with one vector per text, in input order
     */
    CompletableFuture<List<float[]>> embed(@NotNull List<String> texts);

    /**
     * Identifier of the model that produces the vectors, e.g. {@code "text-embedding-3-small"}.
     */
    @NotNull
    String modelVersion();

    default CompletableFuture<float[]> embedSingle(@NotNull String text) {
        return embed(List.of(text)).thenApply(embeddings -> {
            if (embeddings.isEmpty()) {
                throw new IllegalStateException("Embedding function returned no vector");
            }
            return embeddings.get(0);
        });
    }
}
