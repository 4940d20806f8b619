package br.edu.ifba.journal.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.journal.context.ContextBudgeter;
import br.edu.ifba.journal.embedding.EmbeddingFunction;
import br.edu.ifba.journal.exception.EntryNotFoundException;
import br.edu.ifba.journal.graph.KnowledgeGraphStore;
import br.edu.ifba.journal.llm.LLMFunction;
import br.edu.ifba.journal.nlu.ExtractionResponseParser;
import br.edu.ifba.journal.nlu.ExtractionStrategy;
import br.edu.ifba.journal.nlu.FactExtractor;
import br.edu.ifba.journal.nlu.GenerativeExtractionStrategy;
import br.edu.ifba.journal.nlu.LexicalEntityTagger;
import br.edu.ifba.journal.pipeline.EntrySavePipeline;
import br.edu.ifba.journal.pipeline.GenerateStage;
import br.edu.ifba.journal.pipeline.GreetingResponder;
import br.edu.ifba.journal.pipeline.ReplyGenerator;
import br.edu.ifba.journal.pipeline.RetrieveStage;
import br.edu.ifba.journal.pipeline.RouteStage;
import br.edu.ifba.journal.pipeline.SaveOutcome;
import br.edu.ifba.journal.pipeline.TurnOutcome;
import br.edu.ifba.journal.pipeline.TurnPipeline;
import br.edu.ifba.journal.pipeline.ValidateStage;
import br.edu.ifba.journal.prompt.IntentRouter;
import br.edu.ifba.journal.prompt.ResponseFormatValidator;
import br.edu.ifba.journal.prompt.SelfAwarenessDetector;
import br.edu.ifba.journal.retrieval.SemanticRetriever;
import br.edu.ifba.journal.retrieval.TranscriptChunker;
import br.edu.ifba.journal.session.SessionRegistry;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.storage.EntryStorage;
import br.edu.ifba.journal.storage.GraphStorage;
import br.edu.ifba.journal.summary.TranscriptSummarizer;
import br.edu.ifba.journal.utils.RetryEventLogger;

/**
 * The journaling assistant: one reply per user message, and saved sessions turned into
 * searchable entries.
 *
 * <p>Framework-free. Collaborators are passed to the {@link Builder}; storages must already be
 * initialized.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * Journal journal = Journal.builder()
 *     .llmFunction(llm)
 *     .embeddingFunction(embeddings)
 *     .chunkStorage(chunks)
 *     .entryStorage(entries)
 *     .graphStorage(graph)
 *     .executor(workers)
 *     .build();
 *
 * TurnOutcome outcome = journal.handleTurn("user-1", "session-1", "Work was rough today");
 * SaveOutcome saved = journal.saveEntry("user-1", "session-1");
 * }</pre>
 */
public class Journal {

    private static final Logger logger = LoggerFactory.getLogger(Journal.class);

    public static final int DEFAULT_LIST_LIMIT = 50;
    public static final int RECENT_LIMIT = 5;

    private final JournalSettings settings;
    private final TurnPipeline turnPipeline;
    private final EntrySavePipeline savePipeline;
    private final SessionRegistry sessions;
    private final EntryStorage entryStorage;
    private final ChunkStorage chunkStorage;
    private final KnowledgeGraphStore graphStore;

    private Journal(Builder builder, KnowledgeGraphStore graphStore, TurnPipeline turnPipeline, EntrySavePipeline savePipeline) {
        this.settings = builder.settings;
        this.sessions = builder.sessions;
        this.entryStorage = builder.entryStorage;
        this.chunkStorage = builder.chunkStorage;
        this.graphStore = graphStore;
        this.turnPipeline = turnPipeline;
        this.savePipeline = savePipeline;
    }

    /**
     * Blocking form of {@link #handleTurnAsync}.
     */
    @NotNull
    public TurnOutcome handleTurn(@NotNull String ownerId, @NotNull String sessionId, @NotNull String message) {
        return handleTurnAsync(ownerId, sessionId, message).join();
    }

    /**
     * Answers one message of a session and records both sides in the session transcript. A failed
     * turn records only the user's message.
     *
     * @throws IllegalArgumentException if the owner or the message is blank
     */
    @NotNull
    public CompletableFuture<TurnOutcome> handleTurnAsync(@NotNull String ownerId, @NotNull String sessionId, @NotNull String message) {
        requireOwner(ownerId);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
        String text = message.strip();
        List<Turn> history = sessions.transcript(ownerId, sessionId);

        return turnPipeline.execute(ownerId, text, history).thenApply(outcome -> {
            if (outcome.failed()) {
                sessions.append(ownerId, sessionId, Turn.user(text));
            } else {
                sessions.append(ownerId, sessionId, Turn.user(text), Turn.assistant(outcome.reply()));
            }
            return outcome;
        });
    }

    /**
     * Saves the session transcript as an entry and clears the saved turns from the session.
     *
     * @throws IllegalArgumentException if the session has no turns
     * @throws br.edu.ifba.journal.exception.EntryPersistenceException if the entry could not be stored
     */
    @NotNull
    public SaveOutcome saveEntry(@NotNull String ownerId, @NotNull String sessionId) {
        requireOwner(ownerId);
        List<Turn> transcript = sessions.transcript(ownerId, sessionId);
        if (transcript.isEmpty()) {
            throw new IllegalArgumentException("Session " + sessionId + " has no turns to save");
        }
        SaveOutcome outcome = savePipeline.save(ownerId, transcript);
        sessions.clear(ownerId, sessionId, transcript.size());
        return outcome;
    }

    @NotNull
    public List<Entry> listEntries(@NotNull String ownerId) {
        return listEntries(ownerId, DEFAULT_LIST_LIMIT);
    }

    /**
     * Entries of the owner, newest first.
     */
    @NotNull
    public List<Entry> listEntries(@NotNull String ownerId, int limit) {
        requireOwner(ownerId);
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive, got " + limit);
        }
        return entryStorage.findByOwner(ownerId, limit);
    }

    @NotNull
    public List<Entry> recentEntries(@NotNull String ownerId) {
        return listEntries(ownerId, RECENT_LIMIT);
    }

    /**
     * @throws EntryNotFoundException if the owner has no entry with this id
     */
    @NotNull
    public Entry getEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        requireOwner(ownerId);
        return entryStorage.findById(ownerId, entryId)
            .orElseThrow(() -> new EntryNotFoundException(entryId));
    }

    /**
     * Deletes an entry and its chunks. Graph nodes derived from it are kept.
     *
     * @throws EntryNotFoundException if the owner has no entry with this id
     */
    public void deleteEntry(@NotNull String ownerId, @NotNull UUID entryId) {
        getEntry(ownerId, entryId);
        int chunks = chunkStorage.deleteByEntry(ownerId, entryId).join();
        if (!entryStorage.delete(ownerId, entryId)) {
            throw new EntryNotFoundException(entryId);
        }
        logger.info("Deleted entry {} of owner {} with {} chunks", entryId, ownerId, chunks);
    }

    /**
     * Declares graph uniqueness constraints. Does nothing when no graph is configured.
     */
    public void declareGraphConstraints() {
        if (graphStore != null) {
            graphStore.declareConstraints();
        }
    }

    public boolean isGraphEnabled() {
        return graphStore != null;
    }

    /**
     * @return graph statistics, or null when no graph is configured
     */
    public GraphStorage.GraphStats graphStats(@NotNull String ownerId) {
        return graphStore == null ? null : graphStore.stats(ownerId);
    }

    @NotNull
    public JournalSettings getSettings() {
        return settings;
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private JournalSettings settings = JournalSettings.defaults();
        private LLMFunction llmFunction;
        private EmbeddingFunction embeddingFunction;
        private ChunkStorage chunkStorage;
        private EntryStorage entryStorage;
        private GraphStorage graphStorage;
        private Executor executor;
        private BooleanSupplier generationAvailability = () -> true;
        private ObjectMapper objectMapper = new ObjectMapper();
        private SessionRegistry sessions = new SessionRegistry();
        private RetryEventLogger retryEventLogger = new RetryEventLogger();
        private Clock clock = Clock.systemUTC();

        public Builder settings(@NotNull JournalSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder llmFunction(@NotNull LLMFunction llmFunction) {
            this.llmFunction = llmFunction;
            return this;
        }

        public Builder embeddingFunction(@NotNull EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public Builder chunkStorage(@NotNull ChunkStorage chunkStorage) {
            this.chunkStorage = chunkStorage;
            return this;
        }

        public Builder entryStorage(@NotNull EntryStorage entryStorage) {
            this.entryStorage = entryStorage;
            return this;
        }

        /**
         * Optional. Ignored when the graph is disabled in the settings.
         */
        public Builder graphStorage(GraphStorage graphStorage) {
            this.graphStorage = graphStorage;
            return this;
        }

        /**
         * Runs retrieval and NLU of a turn concurrently. Owned by the caller.
         */
        public Builder executor(@NotNull Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Whether the generation model is currently worth calling for extraction, e.g. a closed
         * circuit breaker. When false, extraction goes straight to the lexical tagger.
         */
        public Builder generationAvailability(@NotNull BooleanSupplier generationAvailability) {
            this.generationAvailability = generationAvailability;
            return this;
        }

        public Builder objectMapper(@NotNull ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder sessions(@NotNull SessionRegistry sessions) {
            this.sessions = sessions;
            return this;
        }

        public Builder retryEventLogger(@NotNull RetryEventLogger retryEventLogger) {
            this.retryEventLogger = retryEventLogger;
            return this;
        }

        public Builder clock(@NotNull Clock clock) {
            this.clock = clock;
            return this;
        }

        public Journal build() {
            if (llmFunction == null) {
                throw new IllegalStateException("llmFunction is required");
            }
            if (embeddingFunction == null) {
                throw new IllegalStateException("embeddingFunction is required");
            }
            if (chunkStorage == null) {
                throw new IllegalStateException("chunkStorage is required");
            }
            if (entryStorage == null) {
                throw new IllegalStateException("entryStorage is required");
            }
            if (executor == null) {
                throw new IllegalStateException("executor is required");
            }

            KnowledgeGraphStore graphStore = settings.graphEnabled() && graphStorage != null
                ? new KnowledgeGraphStore(graphStorage, settings.graphTimeoutMs(), settings.graphMaxFacts())
                : null;

            FactExtractor factExtractor = new FactExtractor(strategies(), settings.nluTimeoutMs());
            SemanticRetriever retriever = new SemanticRetriever(embeddingFunction, chunkStorage, settings.retrievalTimeoutMs());
            ContextBudgeter budgeter = new ContextBudgeter();
            ReplyGenerator generator = new ReplyGenerator(
                llmFunction,
                retryEventLogger,
                settings.generationMaxTokens(),
                settings.temperature(),
                settings.generationHistoryTurns(),
                settings.maxRetries(),
                settings.retryDelayMs());

            TurnPipeline turnPipeline = TurnPipeline.builder()
                .addStage(new RetrieveStage(retriever, factExtractor, graphStore, executor,
                    settings.topK(), settings.graphDepth(), settings.nluHistoryTurns()))
                .addStage(new RouteStage(
                    new IntentRouter(settings.gentleIntensity(), settings.acknowledgeThreshold(), new SelfAwarenessDetector()),
                    budgeter,
                    settings.contextMaxTokens()))
                .addStage(new GenerateStage(generator, settings.wordCeiling()))
                .addStage(new ValidateStage(generator, new ResponseFormatValidator(settings.wordCeiling()), retryEventLogger))
                .greetingResponder(new GreetingResponder(retriever, budgeter, llmFunction, settings.contextMaxTokens()))
                .build();

            EntrySavePipeline savePipeline = new EntrySavePipeline(
                new TranscriptSummarizer(llmFunction, settings.summaryTimeoutMs()),
                entryStorage,
                new TranscriptChunker(settings.chunkTokens()),
                retriever,
                factExtractor,
                graphStore,
                settings.graphTimeoutMs(),
                clock);

            logger.info("Journal built: graph={}, generativeNlu={}, contextMaxTokens={}, topK={}",
                graphStore != null, settings.generativeNluEnabled(), settings.contextMaxTokens(), settings.topK());
            return new Journal(this, graphStore, turnPipeline, savePipeline);
        }

        private List<ExtractionStrategy> strategies() {
            List<ExtractionStrategy> strategies = new ArrayList<>();
            if (settings.generativeNluEnabled()) {
                strategies.add(new GenerativeExtractionStrategy(
                    llmFunction,
                    new ExtractionResponseParser(objectMapper),
                    generationAvailability,
                    settings.nluMaxInputChars(),
                    settings.nluHistoryTurns(),
                    retryEventLogger));
            }
            strategies.add(new LexicalEntityTagger());
            return strategies;
        }
    }
}
