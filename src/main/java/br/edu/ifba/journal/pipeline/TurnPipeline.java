package br.edu.ifba.journal.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.prompt.GreetingDetector;
import br.edu.ifba.journal.prompt.PromptTemplates;

/**
 * Runs one user message through the read-path.
 *
 * <pre>
 * IDLE → RETRIEVING → ROUTING → GENERATING → VALIDATING → DONE
 *                                    ↓
 *                                  FAILED (static apology)
 * </pre>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * TurnPipeline pipeline = TurnPipeline.builder()
 *     .addStage(new RetrieveStage(retriever, extractor, graphStore, executor, 5, 1, 4))
 *     .addStage(new RouteStage(router, budgeter, 1500))
 *     .addStage(new GenerateStage(generator, 50))
 *     .addStage(new ValidateStage(generator, validator, retryEventLogger))
 *     .greetingResponder(greetingResponder)
 *     .build();
 *
 * TurnOutcome outcome = pipeline.execute(ownerId, message, history).join();
 * }</pre>
 *
 * <p>The returned future does not complete exceptionally: a stage that throws ends the turn in
 * {@link TurnState#FAILED} with the static apology.</p>
 */
public class TurnPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TurnPipeline.class);

    private final List<TurnStage> stages;
    private final GreetingResponder greetingResponder;

    private TurnPipeline(Builder builder) {
        this.stages = List.copyOf(builder.stages);
        this.greetingResponder = builder.greetingResponder;
    }

    @NotNull
    public CompletableFuture<TurnOutcome> execute(@NotNull String ownerId, @NotNull String message, @NotNull List<Turn> history) {
        long startTime = System.currentTimeMillis();

        if (greetingResponder != null && GreetingDetector.isGreeting(message)) {
            logger.info("Greeting from owner {}", ownerId);
            return greetingResponder.respond(ownerId, message).thenApply(TurnOutcome::greeting);
        }

        TurnContext context = new TurnContext(ownerId, message, history);
        CompletableFuture<TurnContext> future = CompletableFuture.completedFuture(context);
        for (TurnStage stage : stages) {
            future = future.thenCompose(ctx -> executeStage(stage, ctx));
        }

        return future
            .exceptionally(e -> {
                Throwable cause = ReplyGenerator.unwrap(e);
                logger.error("Turn pipeline failed for owner {}: {}", ownerId, cause.getMessage(), cause);
                context.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage(), PromptTemplates.STATIC_APOLOGY);
                return context;
            })
            .thenApply(ctx -> {
                if (!ctx.getState().isTerminal()) {
                    settle(ctx);
                }
                TurnOutcome outcome = TurnOutcome.of(ctx);
                logger.info("Turn completed in {}ms for owner {}: state={}, flagged={}, semantic={}, nlu={}, graph={}, contextTokens={}",
                    System.currentTimeMillis() - startTime, ownerId, outcome.state(), outcome.flagged(),
                    outcome.semanticAvailable(), outcome.nluAvailable(), outcome.graphAvailable(), outcome.contextTokens());
                return outcome;
            });
    }

    // pipelines assembled without a validate stage end here
    private static void settle(TurnContext context) {
        String reply = context.getReply();
        if (reply == null || reply.isBlank()) {
            context.fail("no reply produced", PromptTemplates.STATIC_APOLOGY);
        } else {
            context.transitionTo(TurnState.DONE);
        }
    }

    private CompletableFuture<TurnContext> executeStage(@NotNull TurnStage stage, @NotNull TurnContext context) {
        if (stage.shouldSkip(context)) {
            logger.debug("Skipping stage: {}", stage.getName());
            return CompletableFuture.completedFuture(context);
        }

        logger.debug("Executing stage: {}", stage.getName());
        long stageStart = System.currentTimeMillis();
        CompletableFuture<TurnContext> processed;
        try {
            processed = stage.process(context);
        } catch (RuntimeException e) {
            processed = CompletableFuture.failedFuture(e);
        }
        return processed.thenApply(ctx -> {
            logger.debug("Stage {} completed in {}ms", stage.getName(), System.currentTimeMillis() - stageStart);
            return ctx;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<TurnStage> stages = new ArrayList<>();
        private GreetingResponder greetingResponder;

        /**
         * Stages run in the order they are added.
         */
        public Builder addStage(@NotNull TurnStage stage) {
            this.stages.add(stage);
            return this;
        }

        /**
         * Without a responder greetings go through the full pipeline.
         */
        public Builder greetingResponder(GreetingResponder greetingResponder) {
            this.greetingResponder = greetingResponder;
            return this;
        }

        public TurnPipeline build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("At least one stage is required");
            }
            return new TurnPipeline(this);
        }
    }
}
