package br.edu.ifba.journal.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;

/**
 * Retrieval-sized slice of an entry with its embedding.
 *
 * <p>The embedding version identifies the model that produced the vector. Vectors of different
 * versions live in different spaces and are never ranked against each other.</p>
 */
public record Chunk(
    @NotNull UUID id,
    @NotNull UUID entryId,
    @NotNull String ownerId,
    @NotNull String text,
    @NotNull float[] embedding,
    @NotNull String embeddingVersion,
    @NotNull Instant createdAt
) {

    public Chunk {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(entryId, "entryId must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(embedding, "embedding must not be null");
        Objects.requireNonNull(embeddingVersion, "embeddingVersion must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}
