package br.edu.ifba.journal.pipeline;

import java.util.List;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;

/**
 * Result of saving a session as an entry.
 *
 * @param entryId id of the persisted entry
 * @param summary stored summary
 * @param chunksIndexed chunks embedded and stored, 0 when indexing failed
 * @param graphUpdated whether the entry's facts reached the graph
 * @param degraded names of best-effort steps that failed
 */
public record SaveOutcome(
    @NotNull UUID entryId,
    @NotNull String summary,
    int chunksIndexed,
    boolean graphUpdated,
    @NotNull List<String> degraded
) {

    public SaveOutcome {
        degraded = List.copyOf(degraded);
    }

    public boolean isDegraded() {
        return !degraded.isEmpty();
    }
}
