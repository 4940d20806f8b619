package br.edu.ifba.journal.api;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.Turn;

public record EntryResponse(
    UUID id,
    String summary,
    List<String> transcript,
    Instant createdAt
) {

    public static EntryResponse from(final Entry entry) {
        return new EntryResponse(
            entry.id(),
            entry.summary(),
            entry.transcript().stream().map(Turn::transcriptLine).toList(),
            entry.createdAt());
    }
}
