package br.edu.ifba.journal.core;

import java.util.Comparator;

import org.jetbrains.annotations.NotNull;

/**
 * A chunk returned by similarity search.
 *
 * @param chunk the matching chunk
 * @param similarity cosine similarity to the query, in [-1, 1]
 */
public record ScoredChunk(@NotNull Chunk chunk, double similarity) {

    /** Highest similarity first; equal scores put the newer chunk first. */
    public static final Comparator<ScoredChunk> RANKING = Comparator
        .comparingDouble(ScoredChunk::similarity).reversed()
        .thenComparing((ScoredChunk scored) -> scored.chunk().createdAt(), Comparator.reverseOrder())
        .thenComparing(scored -> scored.chunk().id());
}
