package br.edu.ifba.journal.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.core.StageResult;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.prompt.FormatCheck;
import br.edu.ifba.journal.prompt.RoutingDecision;

/**
 * State that flows through the turn pipeline stages.
 *
 * <p>Each stage reads what earlier stages left here and writes its own outputs. One instance
 * lives for one invocation and is never shared between turns.</p>
 *
 * <h2>Pipeline Flow:</h2>
 * <pre>
 * message → [Retrieve] → [Route] → [Generate] → [Validate] → reply
 *              ↓            ↓           ↓            ↓
 *     semantic, facts,   routing,     reply      formatCheck,
 *         graph          context                   flagged
 * </pre>
 */
public final class TurnContext {

    // === Input data ===

    private final String ownerId;
    private final String message;
    private final List<Turn> history;

    // === Stage outputs ===

    private TurnState state = TurnState.IDLE;

    private StageResult<List<ScoredChunk>> semantic = StageResult.skipped("not run");
    private StageResult<ExtractedFact> facts = StageResult.skipped("not run");
    private StageResult<List<GraphFact>> graph = StageResult.skipped("not run");

    @Nullable
    private RoutingDecision routing;

    @Nullable
    private ContextBlock contextBlock;

    @Nullable
    private String reply;

    @Nullable
    private FormatCheck formatCheck;

    private int generationCalls = 0;
    private boolean flagged = false;

    @Nullable
    private String failureReason;

    private final List<String> trace = new ArrayList<>();

    public TurnContext(@NotNull String ownerId, @NotNull String message, @NotNull List<Turn> history) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.history = List.copyOf(history);
    }

    // === Getters and setters ===

    @NotNull
    public String getOwnerId() {
        return ownerId;
    }

    @NotNull
    public String getMessage() {
        return message;
    }

    @NotNull
    public List<Turn> getHistory() {
        return history;
    }

    @NotNull
    public TurnState getState() {
        return state;
    }

    /**
     * Moves to the next state. Terminal states are final.
     */
    public void transitionTo(@NotNull TurnState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Turn already finished in state " + state);
        }
        trace.add(state + "->" + next);
        this.state = next;
    }

    /**
     * Ends the turn in {@link TurnState#FAILED} with the given reply.
     */
    public void fail(@NotNull String reason, @NotNull String fallbackReply) {
        this.failureReason = reason;
        this.reply = fallbackReply;
        if (!state.isTerminal()) {
            transitionTo(TurnState.FAILED);
        }
    }

    @NotNull
    public StageResult<List<ScoredChunk>> getSemantic() {
        return semantic;
    }

    public void setSemantic(@NotNull StageResult<List<ScoredChunk>> semantic) {
        this.semantic = semantic;
    }

    @NotNull
    public StageResult<ExtractedFact> getFacts() {
        return facts;
    }

    public void setFacts(@NotNull StageResult<ExtractedFact> facts) {
        this.facts = facts;
    }

    @NotNull
    public StageResult<List<GraphFact>> getGraph() {
        return graph;
    }

    public void setGraph(@NotNull StageResult<List<GraphFact>> graph) {
        this.graph = graph;
    }

    @Nullable
    public RoutingDecision getRouting() {
        return routing;
    }

    public void setRouting(@NotNull RoutingDecision routing) {
        this.routing = routing;
    }

    @Nullable
    public ContextBlock getContextBlock() {
        return contextBlock;
    }

    public void setContextBlock(@NotNull ContextBlock contextBlock) {
        this.contextBlock = contextBlock;
    }

    @Nullable
    public String getReply() {
        return reply;
    }

    public void setReply(@NotNull String reply) {
        this.reply = reply;
    }

    @Nullable
    public FormatCheck getFormatCheck() {
        return formatCheck;
    }

    public void setFormatCheck(@NotNull FormatCheck formatCheck) {
        this.formatCheck = formatCheck;
    }

    public int getGenerationCalls() {
        return generationCalls;
    }

    public void countGenerationCall() {
        this.generationCalls++;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public void setFlagged(boolean flagged) {
        this.flagged = flagged;
    }

    @Nullable
    public String getFailureReason() {
        return failureReason;
    }

    /**
     * State transitions taken so far, e.g. {@code "IDLE->RETRIEVING"}.
     */
    @NotNull
    public List<String> getTrace() {
        return List.copyOf(trace);
    }

    /**
     * Current-turn reading, or an empty reading when NLU was unavailable.
     */
    @NotNull
    public ExtractedFact factsOrEmpty() {
        return facts.valueOr(ExtractedFact.empty());
    }
}
