package br.edu.ifba.journal.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.exception.EntryPersistenceException;
import br.edu.ifba.journal.graph.KnowledgeGraphStore;
import br.edu.ifba.journal.nlu.FactExtractor;
import br.edu.ifba.journal.retrieval.SemanticRetriever;
import br.edu.ifba.journal.retrieval.TranscriptChunker;
import br.edu.ifba.journal.storage.EntryStorage;
import br.edu.ifba.journal.summary.TranscriptSummarizer;
import br.edu.ifba.journal.utils.UuidUtils;

/**
 * Turns a finished session into a stored entry and the knowledge derived from it.
 *
 * <pre>
 * transcript → summarize → persist entry → chunk → embed + store → NLU over summary → graph upsert
 * </pre>
 *
 * <p>Only persisting the entry is fatal. Indexing and the graph update are best-effort: their
 * failures are logged and reported in {@link SaveOutcome#degraded()}, and the entry is kept.</p>
 */
public class EntrySavePipeline {

    private static final Logger logger = LoggerFactory.getLogger(EntrySavePipeline.class);

    static final String STEP_INDEX = "index";
    static final String STEP_GRAPH = "graph";

    private final TranscriptSummarizer summarizer;
    private final EntryStorage entryStorage;
    private final TranscriptChunker chunker;
    private final SemanticRetriever retriever;
    private final FactExtractor factExtractor;
    private final KnowledgeGraphStore graphStore;
    private final long graphTimeoutMs;
    private final Clock clock;

    /**
     * @param graphStore null when no graph capability is configured
     */
    public EntrySavePipeline(
        @NotNull TranscriptSummarizer summarizer,
        @NotNull EntryStorage entryStorage,
        @NotNull TranscriptChunker chunker,
        @NotNull SemanticRetriever retriever,
        @NotNull FactExtractor factExtractor,
        KnowledgeGraphStore graphStore,
        long graphTimeoutMs,
        @NotNull Clock clock
    ) {
        this.summarizer = summarizer;
        this.entryStorage = entryStorage;
        this.chunker = chunker;
        this.retriever = retriever;
        this.factExtractor = factExtractor;
        this.graphStore = graphStore;
        this.graphTimeoutMs = graphTimeoutMs;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the transcript has no turns
     * @throws EntryPersistenceException if the entry could not be stored
     */
    @NotNull
    public SaveOutcome save(@NotNull String ownerId, @NotNull List<Turn> transcript) {
        if (transcript.isEmpty()) {
            throw new IllegalArgumentException("Cannot save an empty session");
        }

        long start = System.currentTimeMillis();
        String summary = summarizer.summarize(transcript);
        Entry entry = new Entry(UuidUtils.randomV7(), ownerId, summary, transcript, Instant.now(clock));
        persist(entry);

        List<String> degraded = new ArrayList<>();
        int indexed = index(entry, degraded);
        boolean graphUpdated = updateGraph(entry, degraded);

        logger.info("Saved entry {} for owner {} in {}ms: {} turns, {} chunks, graph={}{}",
            entry.id(), ownerId, System.currentTimeMillis() - start, transcript.size(), indexed, graphUpdated,
            degraded.isEmpty() ? "" : ", degraded=" + degraded);
        return new SaveOutcome(entry.id(), summary, indexed, graphUpdated, degraded);
    }

    private void persist(Entry entry) {
        try {
            entryStorage.save(entry);
        } catch (EntryPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EntryPersistenceException("Failed to persist entry " + entry.id(), e);
        }
    }

    private int index(Entry entry, List<String> degraded) {
        try {
            return retriever.index(entry, chunker.chunk(entry)).join();
        } catch (RuntimeException e) {
            logger.warn("Indexing failed for entry {}, entry kept without chunks: {}",
                entry.id(), ReplyGenerator.unwrap(e).getMessage());
            degraded.add(STEP_INDEX);
            return 0;
        }
    }

    private boolean updateGraph(Entry entry, List<String> degraded) {
        if (graphStore == null) {
            return false;
        }
        ExtractedFact facts = factExtractor.extract(entry.summary(), List.of());
        try {
            graphStore.upsertFacts(entry.ownerId(), entry.id(), facts)
                .copy()
                .orTimeout(graphTimeoutMs, TimeUnit.MILLISECONDS)
                .join();
            return true;
        } catch (RuntimeException e) {
            logger.warn("Graph update failed for entry {}: {}", entry.id(), ReplyGenerator.unwrap(e).getMessage());
            degraded.add(STEP_GRAPH);
            return false;
        }
    }
}
