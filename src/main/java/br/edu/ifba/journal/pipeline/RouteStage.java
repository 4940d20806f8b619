package br.edu.ifba.journal.pipeline;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.context.ContextBudgeter;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.prompt.IntentRouter;
import br.edu.ifba.journal.prompt.RoutingDecision;

/**
 * Picks the reply template and fits the retrieved knowledge into the context budget.
 * Unavailable sources contribute nothing.
 */
public class RouteStage implements TurnStage {

    private final IntentRouter router;
    private final ContextBudgeter budgeter;
    private final int maxContextTokens;

    public RouteStage(@NotNull IntentRouter router, @NotNull ContextBudgeter budgeter, int maxContextTokens) {
        this.router = router;
        this.budgeter = budgeter;
        this.maxContextTokens = maxContextTokens;
    }

    @Override
    public CompletableFuture<TurnContext> process(@NotNull TurnContext context) {
        context.transitionTo(TurnState.ROUTING);

        ExtractedFact facts = context.factsOrEmpty();
        RoutingDecision decision = router.route(context.getMessage(), facts);

        ContextBlock block = budgeter.assemble(
            context.getSemantic().valueOr(List.of()),
            context.getGraph().valueOr(List.of()),
            facts,
            maxContextTokens);

        context.setRouting(decision);
        context.setContextBlock(block);
        return CompletableFuture.completedFuture(context);
    }

    @Override
    public String getName() {
        return "route";
    }
}
