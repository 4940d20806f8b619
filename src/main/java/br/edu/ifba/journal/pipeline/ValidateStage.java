package br.edu.ifba.journal.pipeline;

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.prompt.FormatCheck;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.prompt.ResponseFormatValidator;
import br.edu.ifba.journal.prompt.RoutingDecision;
import br.edu.ifba.journal.utils.RetryEventLogger;

/**
 * Enforces the reply format.
 *
 * <p>A draft that breaks the format is regenerated once with a corrective instruction. If the
 * second draft still breaks it, it is served anyway and the turn is flagged. A blank final draft
 * is never served; the turn fails with the static apology instead.</p>
 */
public class ValidateStage implements TurnStage {

    private static final Logger logger = LoggerFactory.getLogger(ValidateStage.class);

    static final String OPERATION = "reply.format";

    private final ReplyGenerator generator;
    private final ResponseFormatValidator validator;
    private final RetryEventLogger retryEventLogger;

    public ValidateStage(
        @NotNull ReplyGenerator generator,
        @NotNull ResponseFormatValidator validator,
        @NotNull RetryEventLogger retryEventLogger
    ) {
        this.generator = generator;
        this.validator = validator;
        this.retryEventLogger = retryEventLogger;
    }

    @Override
    public CompletableFuture<TurnContext> process(@NotNull TurnContext context) {
        context.transitionTo(TurnState.VALIDATING);

        String draft = context.getReply() == null ? "" : context.getReply();
        FormatCheck check = validator.check(draft);
        context.setFormatCheck(check);
        if (check.isValid()) {
            context.transitionTo(TurnState.DONE);
            return CompletableFuture.completedFuture(context);
        }

        logger.info("Reply broke the format ({}), regenerating once", check.describe());
        RoutingDecision decision = GenerateStage.requireRouting(context);
        ContextBlock block = context.getContextBlock() != null ? context.getContextBlock() : ContextBlock.empty(0);
        String systemPrompt = PromptTemplates.replySystemPrompt(decision, block, validator.wordCeiling());
        String prompt = context.getMessage() + "\n\n" + PromptTemplates.correction(check, decision, validator.wordCeiling());

        context.countGenerationCall();
        return generator.generate(prompt, systemPrompt, context.getHistory())
            .handle((regenerated, error) -> {
                if (error != null) {
                    logger.warn("Regeneration unavailable, keeping first draft: {}",
                        ReplyGenerator.unwrap(error).getMessage());
                    return finish(context, draft, check);
                }
                return finish(context, regenerated, validator.check(regenerated));
            });
    }

    private TurnContext finish(TurnContext context, String reply, FormatCheck check) {
        context.setFormatCheck(check);
        if (reply.isBlank()) {
            retryEventLogger.logRetryExhausted(OPERATION, context.getGenerationCalls(),
                new IllegalStateException("blank reply"));
            context.fail("blank reply", PromptTemplates.STATIC_APOLOGY);
            return context;
        }
        context.setReply(reply);
        if (!check.isValid()) {
            context.setFlagged(true);
            retryEventLogger.logServedWithViolations(OPERATION, context.getGenerationCalls(), check.describe());
        } else {
            retryEventLogger.logRetrySuccess(OPERATION, context.getGenerationCalls());
        }
        context.transitionTo(TurnState.DONE);
        return context;
    }

    @Override
    public String getName() {
        return "validate";
    }
}
