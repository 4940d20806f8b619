package br.edu.ifba.journal.storage.impl;

import br.edu.ifba.journal.core.Chunk;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force chunk storage for tests and single-node use.
 */
public class InMemoryChunkStorage implements ChunkStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryChunkStorage.class);

    private final ConcurrentHashMap<UUID, Chunk> chunks = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    @Override
    public CompletableFuture<Void> initialize() {
        if (!initialized) {
            initialized = true;
            logger.info("InMemoryChunkStorage initialized");
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> upsert(@NotNull List<Chunk> batch) {
        ensureInitialized();
        return CompletableFuture.runAsync(() -> {
            for (Chunk chunk : batch) {
                chunks.put(chunk.id(), chunk);
            }
            logger.debug("Upserted {} chunks", batch.size());
        });
    }

    @Override
    public CompletableFuture<List<ScoredChunk>> nearest(
            @NotNull String ownerId,
            @NotNull float[] queryVector,
            int k,
            @NotNull String embeddingVersion) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> chunks.values().stream()
            .filter(chunk -> chunk.ownerId().equals(ownerId))
            .filter(chunk -> chunk.embeddingVersion().equals(embeddingVersion))
            .filter(chunk -> chunk.embedding().length == queryVector.length)
            .map(chunk -> new ScoredChunk(chunk, EmbeddingUtil.cosineSimilarity(queryVector, chunk.embedding())))
            .sorted(ScoredChunk.RANKING)
            .limit(Math.max(0, k))
            .toList());
    }

    @Override
    public CompletableFuture<Integer> deleteByEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            int before = chunks.size();
            chunks.values().removeIf(chunk -> chunk.ownerId().equals(ownerId) && chunk.entryId().equals(entryId));
            return before - chunks.size();
        });
    }

    @Override
    public CompletableFuture<Integer> countByEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        ensureInitialized();
        return CompletableFuture.completedFuture((int) chunks.values().stream()
            .filter(chunk -> chunk.ownerId().equals(ownerId) && chunk.entryId().equals(entryId))
            .count());
    }

    @Override
    public void close() {
        chunks.clear();
        initialized = false;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
