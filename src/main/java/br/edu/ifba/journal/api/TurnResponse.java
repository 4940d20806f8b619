package br.edu.ifba.journal.api;

import br.edu.ifba.journal.pipeline.TurnOutcome;

/**
 * Reply to one message.
 *
 * @param reply text to show the user
 * @param flagged true when the reply was served although it breaks the reply format
 * @param degraded true when the turn failed or a knowledge source was unavailable
 */
public record TurnResponse(
    String reply,
    boolean flagged,
    boolean degraded
) {

    public static TurnResponse from(final TurnOutcome outcome) {
        final boolean degraded = outcome.failed()
            || (!outcome.greeting() && !(outcome.semanticAvailable() && outcome.nluAvailable()));
        return new TurnResponse(outcome.reply(), outcome.flagged(), degraded);
    }
}
