package br.edu.ifba.journal.storage;

import br.edu.ifba.journal.core.Chunk;
import br.edu.ifba.journal.core.ScoredChunk;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Storage of embedded chunks with owner-scoped nearest-neighbour search.
 *
 * <p>Owner and embedding version are part of the search predicate: implementations never score a
 * chunk of another owner or another embedding space.</p>
 */
public interface ChunkStorage extends AutoCloseable {

    CompletableFuture<Void> initialize();

    /**
     * Inserts or replaces chunks by id. Storing the same chunk id twice keeps one row.
     */
    CompletableFuture<Void> upsert(@NotNull List<Chunk> chunks);

    /**
     * Returns up to {@code k} chunks of the owner, with the given embedding version, ranked by
     * {@link ScoredChunk#RANKING}.
     */
    CompletableFuture<List<ScoredChunk>> nearest(
        @NotNull String ownerId,
        @NotNull float[] queryVector,
        int k,
        @NotNull String embeddingVersion
    );

    /**
     * Deletes every chunk of an entry.
     *
     * @return number of deleted chunks
     */
    CompletableFuture<Integer> deleteByEntry(@NotNull String ownerId, @NotNull UUID entryId);

    CompletableFuture<Integer> countByEntry(@NotNull String ownerId, @NotNull UUID entryId);

    @Override
    void close();
}
