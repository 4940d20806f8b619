package br.edu.ifba.journal.retrieval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Chunk;
import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.embedding.EmbeddingFunction;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.utils.UuidUtils;

/**
 * Similarity search over the chunks of a user's past entries.
 *
 * <p>Queries are embedded with the same {@link EmbeddingFunction} used by {@link #index}, and only
 * chunks stored under its current {@link EmbeddingFunction#modelVersion()} are ranked.
 * {@link #retrieve} degrades to an empty list on any failure; {@link #search} and {@link #index}
 * let failures through so the caller can record them.</p>
 */
public class SemanticRetriever {

    private static final Logger logger = LoggerFactory.getLogger(SemanticRetriever.class);

    private final EmbeddingFunction embeddingFunction;
    private final ChunkStorage chunkStorage;
    private final long timeoutMs;

    public SemanticRetriever(
        @NotNull EmbeddingFunction embeddingFunction,
        @NotNull ChunkStorage chunkStorage,
        long timeoutMs
    ) {
        this.embeddingFunction = embeddingFunction;
        this.chunkStorage = chunkStorage;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Blocking form of {@link #retrieveAsync}. Never throws.
     */
    @NotNull
    public List<ScoredChunk> retrieve(@NotNull String queryText, @NotNull String ownerId, int k) {
        return retrieveAsync(queryText, ownerId, k).join();
    }

    /**
     * Up to {@code k} chunks of the owner, most similar first, newer first on equal scores.
     * The future never completes exceptionally.
     */
    @NotNull
    public CompletableFuture<List<ScoredChunk>> retrieveAsync(@NotNull String queryText, @NotNull String ownerId, int k) {
        return search(queryText, ownerId, k)
            .exceptionally(e -> {
                logger.warn("Semantic retrieval unavailable for owner {}: {}", ownerId, e.getMessage());
                return List.of();
            });
    }

    /**
     * Like {@link #retrieveAsync}, but an embedding or storage failure, or the time limit
     * passing, completes the future exceptionally so the caller can tell "nothing similar" from
     * "search unavailable".
     */
    @NotNull
    public CompletableFuture<List<ScoredChunk>> search(@NotNull String queryText, @NotNull String ownerId, int k) {
        if (queryText.isBlank() || k <= 0) {
            return CompletableFuture.completedFuture(List.of());
        }

        String version = embeddingFunction.modelVersion();
        CompletableFuture<List<ScoredChunk>> search;
        try {
            search = embeddingFunction.embedSingle(queryText)
                .thenCompose(vector -> chunkStorage.nearest(ownerId, vector, k, version))
                .copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            search = CompletableFuture.failedFuture(e);
        }

        return search.thenApply(results -> {
            logger.debug("Retrieved {} chunks for owner {} (k={}, version={})",
                results.size(), ownerId, k, version);
            return results;
        });
    }

    /**
     * Embeds the texts of an entry and stores them as chunks.
     *
     * <p>Chunk ids are derived from (entry id, slice index, embedding version), so indexing the
     * same entry again replaces its chunks instead of adding copies.</p>
     *
     * @return number of chunks stored
     */
    @NotNull
    public CompletableFuture<Integer> index(@NotNull Entry entry, @NotNull List<String> texts) {
        if (texts.isEmpty()) {
            return CompletableFuture.completedFuture(0);
        }

        String version = embeddingFunction.modelVersion();
        return embeddingFunction.embed(texts)
            .thenCompose(vectors -> {
                if (vectors.size() != texts.size()) {
                    throw new IllegalStateException(String.format(
                        "Embedding returned %d vectors for %d texts", vectors.size(), texts.size()));
                }

                Instant now = Instant.now();
                List<Chunk> chunks = new ArrayList<>(texts.size());
                for (int i = 0; i < texts.size(); i++) {
                    chunks.add(new Chunk(
                        chunkId(entry, i, version),
                        entry.id(),
                        entry.ownerId(),
                        texts.get(i),
                        vectors.get(i),
                        version,
                        now));
                }
                return chunkStorage.upsert(chunks).thenApply(ignored -> chunks.size());
            })
            .whenComplete((count, error) -> {
                if (error == null) {
                    logger.info("Indexed {} chunks for entry {}", count, entry.id());
                }
            });
    }

    @NotNull
    static UUID chunkId(@NotNull Entry entry, int index, @NotNull String version) {
        return UuidUtils.deterministicV5(entry.id() + ":" + index + ":" + version);
    }
}
