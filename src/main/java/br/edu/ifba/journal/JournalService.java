package br.edu.ifba.journal;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.journal.adapters.QuarkusEmbeddingAdapter;
import br.edu.ifba.journal.adapters.QuarkusLLMAdapter;
import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.Journal;
import br.edu.ifba.journal.core.JournalSettings;
import br.edu.ifba.journal.pipeline.SaveOutcome;
import br.edu.ifba.journal.pipeline.TurnOutcome;
import br.edu.ifba.journal.storage.ChunkStorage;
import br.edu.ifba.journal.storage.EntryStorage;
import br.edu.ifba.journal.storage.GraphStorage;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Owns the {@link Journal} instance and the worker pool it runs on.
 *
 * <p>The journal is built once at startup from {@link JournalConfig}, the model adapters and the
 * storages selected by {@code journal.storage.backend}. Generative extraction is skipped while
 * the chat circuit is open.</p>
 */
@ApplicationScoped
@Startup
public class JournalService {

    private static final Logger LOG = Logger.getLogger(JournalService.class);

    @Inject
    JournalConfig config;

    @Inject
    QuarkusLLMAdapter llmAdapter;

    @Inject
    QuarkusEmbeddingAdapter embeddingAdapter;

    @Inject
    ChunkStorage chunkStorage;

    @Inject
    EntryStorage entryStorage;

    @Inject
    GraphStorage graphStorage;

    @Inject
    ObjectMapper objectMapper;

    private ExecutorService workers;
    private Journal journal;

    @PostConstruct
    void initialize() {
        config.validate();

        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory threadFactory = task -> {
            final Thread thread = new Thread(task, "journal-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        workers = Executors.newFixedThreadPool(config.workerThreads(), threadFactory);

        journal = Journal.builder()
            .settings(settingsFrom(config))
            .llmFunction(llmAdapter)
            .embeddingFunction(embeddingAdapter)
            .chunkStorage(chunkStorage)
            .entryStorage(entryStorage)
            .graphStorage(graphStorage)
            .executor(workers)
            .generationAvailability(llmAdapter::isAvailable)
            .objectMapper(objectMapper)
            .build();

        if (journal.isGraphEnabled()) {
            journal.declareGraphConstraints();
        }

        LOG.infof("Journal service started: backend=%s, graph=%s, workers=%d",
            config.storage().backend(), journal.isGraphEnabled(), config.workerThreads());
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down journal service");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public TurnOutcome handleTurn(final String ownerId, final String sessionId, final String message) {
        final TurnOutcome outcome = journal.handleTurn(ownerId, sessionId, message);
        if (outcome.flagged()) {
            LOG.warnf("Served flagged reply to owner %s in session %s", ownerId, sessionId);
        }
        return outcome;
    }

    public SaveOutcome saveEntry(final String ownerId, final String sessionId) {
        final SaveOutcome outcome = journal.saveEntry(ownerId, sessionId);
        LOG.infof("Session %s of owner %s saved as entry %s", sessionId, ownerId, outcome.entryId());
        return outcome;
    }

    public List<Entry> listEntries(final String ownerId, final int limit) {
        return journal.listEntries(ownerId, limit);
    }

    public List<Entry> recentEntries(final String ownerId) {
        return journal.recentEntries(ownerId);
    }

    public Entry getEntry(final String ownerId, final UUID entryId) {
        return journal.getEntry(ownerId, entryId);
    }

    public void deleteEntry(final String ownerId, final UUID entryId) {
        journal.deleteEntry(ownerId, entryId);
    }

    public GraphStorage.GraphStats graphStats(final String ownerId) {
        return journal.graphStats(ownerId);
    }

    static JournalSettings settingsFrom(final JournalConfig config) {
        return new JournalSettings(
            config.context().maxTokens(),
            config.retrieval().topK(),
            config.retrieval().timeoutMs(),
            config.retrieval().chunkTokens(),
            config.nlu().generativeEnabled(),
            config.nlu().timeoutMs(),
            config.nlu().maxInputChars(),
            config.nlu().historyTurns(),
            config.generation().maxTokens(),
            config.generation().temperature(),
            config.generation().wordCeiling(),
            config.generation().historyTurns(),
            config.generation().maxRetries(),
            config.generation().retryDelayMs(),
            config.generation().summaryTimeoutMs(),
            config.routing().gentleIntensity(),
            config.routing().acknowledgeThreshold(),
            config.graph().enabled(),
            config.graph().depth(),
            config.graph().timeoutMs(),
            config.graph().maxFacts()
        );
    }
}
