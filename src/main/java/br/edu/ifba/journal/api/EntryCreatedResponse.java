package br.edu.ifba.journal.api;

import java.util.List;
import java.util.UUID;

import br.edu.ifba.journal.pipeline.SaveOutcome;

/**
 * @param id id of the new entry
 * @param degraded best-effort steps that failed, e.g. "index"
 */
public record EntryCreatedResponse(
    UUID id,
    List<String> degraded
) {

    public static EntryCreatedResponse from(final SaveOutcome outcome) {
        return new EntryCreatedResponse(outcome.entryId(), outcome.degraded());
    }
}
