package br.edu.ifba.journal.pipeline;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Result of one read-path invocation.
 *
 * @param reply text shown to the user, never blank
 * @param state {@link TurnState#DONE} or {@link TurnState#FAILED}
 * @param flagged true when the reply was served although it breaks the reply format
 * @param greeting true when the greeting short-cut answered
 * @param semanticAvailable whether past-entry search contributed
 * @param nluAvailable whether the current message could be read
 * @param graphAvailable whether the graph was queried
 * @param contextTokens tokens of the context block sent to generation
 * @param generationCalls number of generation calls made, retries not counted
 * @param failureReason why the turn failed, null otherwise
 * @param trace state transitions taken
 */
public record TurnOutcome(
    @NotNull String reply,
    @NotNull TurnState state,
    boolean flagged,
    boolean greeting,
    boolean semanticAvailable,
    boolean nluAvailable,
    boolean graphAvailable,
    int contextTokens,
    int generationCalls,
    @Nullable String failureReason,
    @NotNull List<String> trace
) {

    public TurnOutcome {
        trace = List.copyOf(trace);
    }

    static TurnOutcome of(@NotNull TurnContext context) {
        String reply = context.getReply();
        return new TurnOutcome(
            reply == null ? "" : reply,
            context.getState(),
            context.isFlagged(),
            false,
            context.getSemantic().isAvailable(),
            context.getFacts().isAvailable(),
            context.getGraph().isAvailable(),
            context.getContextBlock() == null ? 0 : context.getContextBlock().totalTokens(),
            context.getGenerationCalls(),
            context.getFailureReason(),
            context.getTrace());
    }

    static TurnOutcome greeting(@NotNull String reply) {
        return new TurnOutcome(reply, TurnState.DONE, false, true, false, false, false, 0, 0, null, List.of());
    }

    public boolean failed() {
        return state == TurnState.FAILED;
    }
}
