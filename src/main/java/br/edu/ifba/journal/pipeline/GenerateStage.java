package br.edu.ifba.journal.pipeline;

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.prompt.RoutingDecision;

/**
 * Produces the first reply draft. When the model stays unavailable after its retries the turn
 * ends in {@link TurnState#FAILED} with the static apology.
 */
public class GenerateStage implements TurnStage {

    private static final Logger logger = LoggerFactory.getLogger(GenerateStage.class);

    private final ReplyGenerator generator;
    private final int wordCeiling;

    public GenerateStage(@NotNull ReplyGenerator generator, int wordCeiling) {
        this.generator = generator;
        this.wordCeiling = wordCeiling;
    }

    @Override
    public CompletableFuture<TurnContext> process(@NotNull TurnContext context) {
        context.transitionTo(TurnState.GENERATING);

        RoutingDecision decision = requireRouting(context);
        ContextBlock block = context.getContextBlock() != null
            ? context.getContextBlock()
            : ContextBlock.empty(0);
        String systemPrompt = PromptTemplates.replySystemPrompt(decision, block, wordCeiling);

        context.countGenerationCall();
        return generator.generate(context.getMessage(), systemPrompt, context.getHistory())
            .handle((reply, error) -> {
                if (error != null) {
                    Throwable cause = ReplyGenerator.unwrap(error);
                    logger.error("Generation unavailable for owner {}: {}", context.getOwnerId(), cause.getMessage());
                    context.fail("generation unavailable: " + cause.getMessage(), PromptTemplates.STATIC_APOLOGY);
                    return context;
                }
                context.setReply(reply);
                return context;
            });
    }

    static RoutingDecision requireRouting(TurnContext context) {
        RoutingDecision decision = context.getRouting();
        if (decision == null) {
            throw new IllegalStateException("Turn was not routed before generation");
        }
        return decision;
    }

    @Override
    public String getName() {
        return "generate";
    }
}
