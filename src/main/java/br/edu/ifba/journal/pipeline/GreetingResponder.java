package br.edu.ifba.journal.pipeline;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.context.ContextBlock;
import br.edu.ifba.journal.context.ContextBudgeter;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.llm.LLMFunction;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.retrieval.SemanticRetriever;

/**
 * Answers short greetings.
 *
 * <p>When past entries match, the model writes a welcome that may refer to them; otherwise, or
 * when the model fails, the static welcome is returned. Never fails.</p>
 */
public class GreetingResponder {

    private static final Logger logger = LoggerFactory.getLogger(GreetingResponder.class);

    static final int CONTEXT_SNIPPETS = 3;
    static final int MAX_OUTPUT_TOKENS = 50;
    static final double TEMPERATURE = 0.7;

    private final SemanticRetriever retriever;
    private final ContextBudgeter budgeter;
    private final LLMFunction llmFunction;
    private final int maxContextTokens;

    public GreetingResponder(
        @NotNull SemanticRetriever retriever,
        @NotNull ContextBudgeter budgeter,
        @NotNull LLMFunction llmFunction,
        int maxContextTokens
    ) {
        this.retriever = retriever;
        this.budgeter = budgeter;
        this.llmFunction = llmFunction;
        this.maxContextTokens = maxContextTokens;
    }

    @NotNull
    public CompletableFuture<String> respond(@NotNull String ownerId, @NotNull String message) {
        return retriever.retrieveAsync(message, ownerId, CONTEXT_SNIPPETS).thenCompose(chunks -> {
            ContextBlock block = budgeter.assemble(chunks, List.of(), ExtractedFact.empty(), maxContextTokens);
            if (!block.hasSemantic()) {
                return CompletableFuture.completedFuture(PromptTemplates.STATIC_GREETING);
            }
            return personalised(ownerId, block);
        });
    }

    private CompletableFuture<String> personalised(String ownerId, ContextBlock block) {
        CompletableFuture<String> call;
        try {
            call = llmFunction.apply(
                PromptTemplates.greetingPrompt(block),
                PromptTemplates.GREETING_SYSTEM_PROMPT,
                null,
                Map.of(LLMFunction.MAX_TOKENS, MAX_OUTPUT_TOKENS, LLMFunction.TEMPERATURE, TEMPERATURE));
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((greeting, error) -> {
            if (error != null) {
                logger.warn("Personalised greeting failed for owner {}, using static greeting: {}",
                    ownerId, ReplyGenerator.unwrap(error).getMessage());
                return PromptTemplates.STATIC_GREETING;
            }
            if (greeting == null || greeting.isBlank()) {
                return PromptTemplates.STATIC_GREETING;
            }
            return greeting.strip();
        });
    }
}
