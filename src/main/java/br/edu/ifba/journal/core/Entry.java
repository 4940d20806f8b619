package br.edu.ifba.journal.core;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;

/**
 * A saved journaling session. Immutable once persisted; only deletion changes it.
 *
 * @param id entry id
 * @param ownerId user the entry belongs to
 * @param summary summarized text, the source of the entry's chunks
 * @param transcript ordered turns of the session
 * @param createdAt when the entry was saved
 */
public record Entry(
    @NotNull UUID id,
    @NotNull String ownerId,
    @NotNull String summary,
    @NotNull List<Turn> transcript,
    @NotNull Instant createdAt
) {

    public Entry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        transcript = List.copyOf(transcript);
    }

    public boolean isOwnedBy(@NotNull String candidateOwner) {
        return ownerId.equals(candidateOwner);
    }
}
