package br.edu.ifba.journal.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.core.StageResult;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.graph.KnowledgeGraphStore;
import br.edu.ifba.journal.nlu.FactExtractor;
import br.edu.ifba.journal.retrieval.SemanticRetriever;

/**
 * Gathers the three knowledge sources of a turn.
 *
 * <p>Semantic search and NLU start together on the executor and each keeps its own time limit.
 * The graph is queried once NLU has produced entity names; without names, or with no graph
 * configured, it is skipped. No source failing here fails the turn.</p>
 */
public class RetrieveStage implements TurnStage {

    private static final Logger logger = LoggerFactory.getLogger(RetrieveStage.class);

    private final SemanticRetriever retriever;
    private final FactExtractor factExtractor;
    private final KnowledgeGraphStore graphStore;
    private final Executor executor;
    private final int topK;
    private final int graphDepth;
    private final int nluHistoryTurns;

    /**
     * @param graphStore null when no graph capability is configured
     */
    public RetrieveStage(
        @NotNull SemanticRetriever retriever,
        @NotNull FactExtractor factExtractor,
        KnowledgeGraphStore graphStore,
        @NotNull Executor executor,
        int topK,
        int graphDepth,
        int nluHistoryTurns
    ) {
        this.retriever = retriever;
        this.factExtractor = factExtractor;
        this.graphStore = graphStore;
        this.executor = executor;
        this.topK = topK;
        this.graphDepth = graphDepth;
        this.nluHistoryTurns = nluHistoryTurns;
    }

    @Override
    public CompletableFuture<TurnContext> process(@NotNull TurnContext context) {
        context.transitionTo(TurnState.RETRIEVING);
        String ownerId = context.getOwnerId();
        String message = context.getMessage();

        long semanticStart = System.nanoTime();
        CompletableFuture<StageResult<List<ScoredChunk>>> semantic = CompletableFuture
            .supplyAsync(() -> retriever.search(message, ownerId, topK), executor)
            .thenCompose(future -> future)
            .handle((chunks, error) -> {
                if (error != null) {
                    Throwable cause = ReplyGenerator.unwrap(error);
                    logger.warn("Semantic search unavailable for owner {}: {}", ownerId, cause.toString());
                    return StageResult.<List<ScoredChunk>>unavailable("semantic search failed: " + cause, since(semanticStart));
                }
                return StageResult.available(chunks, since(semanticStart));
            });

        long nluStart = System.nanoTime();
        List<Turn> recent = ReplyGenerator.recent(context.getHistory(), nluHistoryTurns);
        CompletableFuture<StageResult<ExtractedFact>> facts = CompletableFuture
            .supplyAsync(() -> factExtractor.extractAsync(message, recent), executor)
            .thenCompose(future -> future)
            .thenApply(fact -> readingOf(fact, since(nluStart)));

        CompletableFuture<StageResult<List<GraphFact>>> graph = facts
            .thenApplyAsync(reading -> queryGraph(ownerId, reading), executor);

        return CompletableFuture.allOf(semantic, graph).thenApply(ignored -> {
            context.setSemantic(semantic.join());
            context.setFacts(facts.join());
            context.setGraph(graph.join());
            logger.debug("Retrieved for owner {}: semantic={}, facts={}, graph={}",
                ownerId, context.getSemantic(), context.getFacts(), context.getGraph());
            return context;
        });
    }

    private StageResult<List<GraphFact>> queryGraph(String ownerId, StageResult<ExtractedFact> reading) {
        if (graphStore == null) {
            return StageResult.skipped("graph disabled");
        }
        if (!reading.isAvailable() || !reading.value().hasEntities()) {
            return StageResult.skipped("no entities");
        }
        long start = System.nanoTime();
        List<GraphFact> related = graphStore.related(ownerId, reading.value().entityNames(), graphDepth);
        return StageResult.available(related, since(start));
    }

    private static StageResult<ExtractedFact> readingOf(ExtractedFact fact, Duration elapsed) {
        if (ExtractedFact.NONE.equals(fact.extractedBy())) {
            return StageResult.unavailable("no extraction strategy succeeded", elapsed);
        }
        return StageResult.available(fact, elapsed);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public String getName() {
        return "retrieve";
    }
}
