package br.edu.ifba.journal.core;

import br.edu.ifba.journal.exception.EntryNotFoundException;
import br.edu.ifba.journal.pipeline.SaveOutcome;
import br.edu.ifba.journal.pipeline.TurnOutcome;
import br.edu.ifba.journal.pipeline.TurnState;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.session.SessionRegistry;
import br.edu.ifba.journal.storage.impl.InMemoryChunkStorage;
import br.edu.ifba.journal.storage.impl.InMemoryEntryStorage;
import br.edu.ifba.journal.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.journal.support.FakeEmbeddingFunction;
import br.edu.ifba.journal.support.ScriptedLlm;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the journal facade over in-memory storages.
 *
 * <p>Tests:</p>
 * <ul>
 *   <li>Turns recorded in the session transcript</li>
 *   <li>Saving a session and finding it again in later turns</li>
 *   <li>Listing, reading and deleting entries</li>
 *   <li>Input validation and builder requirements</li>
 * </ul>
 */
class JournalTest {

    private ScriptedLlm llm;
    private FakeEmbeddingFunction embeddings;
    private InMemoryChunkStorage chunks;
    private InMemoryEntryStorage entries;
    private InMemoryGraphStorage graph;
    private SessionRegistry sessions;
    private ExecutorService executor;
    private Journal journal;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlm()
            .respond(ScriptedLlm.Kind.SUMMARY, "The user argued with Maria about the budget.");
        embeddings = new FakeEmbeddingFunction();
        chunks = new InMemoryChunkStorage();
        chunks.initialize().join();
        entries = new InMemoryEntryStorage();
        entries.initialize();
        graph = new InMemoryGraphStorage();
        graph.initialize().join();
        sessions = new SessionRegistry();
        executor = Executors.newFixedThreadPool(4);

        journal = Journal.builder()
            .settings(JournalSettings.defaults().withRetryDelayMs(0))
            .llmFunction(llm)
            .embeddingFunction(embeddings)
            .chunkStorage(chunks)
            .entryStorage(entries)
            .graphStorage(graph)
            .sessions(sessions)
            .executor(executor)
            .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Turns")
    class Turns {

        @Test
        @DisplayName("should record the message and the reply in the session")
        void shouldRecordBothSides() {
            TurnOutcome outcome = journal.handleTurn("alice", "s1", "  Work was long today  ");

            assertEquals(TurnState.DONE, outcome.state());
            assertEquals(List.of(Turn.user("Work was long today"), Turn.assistant(outcome.reply())),
                sessions.transcript("alice", "s1"));
        }

        @Test
        @DisplayName("should record only the message when the turn fails")
        void shouldRecordOnlyMessageOnFailure() {
            llm.failing(ScriptedLlm.Kind.REPLY, true);

            TurnOutcome outcome = journal.handleTurn("alice", "s1", "Work was long today");

            assertTrue(outcome.failed());
            assertEquals(PromptTemplates.STATIC_APOLOGY, outcome.reply());
            assertEquals(List.of(Turn.user("Work was long today")), sessions.transcript("alice", "s1"));
        }

        @Test
        @DisplayName("should send earlier turns of the same session as history")
        void shouldSendSessionHistory() {
            journal.handleTurn("alice", "s1", "Work was long today");
            journal.handleTurn("alice", "s1", "My manager kept moving the deadline");

            List<ScriptedLlm.Call> replies = llm.calls(ScriptedLlm.Kind.REPLY);
            assertEquals(2, replies.size());
            assertTrue(replies.get(0).history().isEmpty());
            assertEquals(2, replies.get(1).history().size());
        }

        @Test
        @DisplayName("should reject a blank message or owner")
        void shouldRejectBlankInput() {
            assertThrows(IllegalArgumentException.class, () -> journal.handleTurn("alice", "s1", "   "));
            assertThrows(IllegalArgumentException.class, () -> journal.handleTurn(" ", "s1", "hello there"));
            assertTrue(sessions.transcript("alice", "s1").isEmpty());
        }
    }

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("should save the session and clear it")
        void shouldSaveAndClearSession() {
            journal.handleTurn("alice", "s1", "Maria and I argued about the budget again");

            SaveOutcome saved = journal.saveEntry("alice", "s1");

            Entry entry = journal.getEntry("alice", saved.entryId());
            assertEquals("The user argued with Maria about the budget.", entry.summary());
            assertEquals(2, entry.transcript().size());
            assertTrue(saved.chunksIndexed() > 0);
            assertTrue(saved.graphUpdated());
            assertTrue(sessions.transcript("alice", "s1").isEmpty());
        }

        @Test
        @DisplayName("should bring a saved entry into the context of a later turn")
        void shouldRetrieveSavedEntryLater() {
            journal.handleTurn("alice", "s1", "Maria and I argued about the budget again");
            journal.saveEntry("alice", "s1");

            journal.handleTurn("alice", "s2", "Maria brought up the budget again");

            ScriptedLlm.Call last = llm.calls(ScriptedLlm.Kind.REPLY).get(1);
            assertTrue(last.systemPrompt().contains("The user argued with Maria about the budget."));
        }

        @Test
        @DisplayName("should not show one owner's entries to another")
        void shouldIsolateOwners() {
            journal.handleTurn("alice", "s1", "Maria and I argued about the budget again");
            SaveOutcome saved = journal.saveEntry("alice", "s1");

            assertTrue(journal.listEntries("bob").isEmpty());
            assertThrows(EntryNotFoundException.class, () -> journal.getEntry("bob", saved.entryId()));

            journal.handleTurn("bob", "s1", "Maria brought up the budget again");
            ScriptedLlm.Call bobReply = llm.calls(ScriptedLlm.Kind.REPLY).get(1);
            assertFalse(bobReply.systemPrompt().contains("argued with Maria"));
        }

        @Test
        @DisplayName("should refuse to save an empty session")
        void shouldRejectEmptySession() {
            assertThrows(IllegalArgumentException.class, () -> journal.saveEntry("alice", "nothing-here"));
            assertTrue(journal.listEntries("alice").isEmpty());
        }

        @Test
        @DisplayName("should list entries newest first and cap the recent list")
        void shouldListEntries() {
            for (int i = 0; i < 7; i++) {
                journal.handleTurn("alice", "s" + i, "Note number " + i);
                journal.saveEntry("alice", "s" + i);
            }

            assertEquals(7, journal.listEntries("alice").size());
            assertEquals(3, journal.listEntries("alice", 3).size());
            assertEquals(Journal.RECENT_LIMIT, journal.recentEntries("alice").size());
            assertThrows(IllegalArgumentException.class, () -> journal.listEntries("alice", 0));

            List<Entry> listed = journal.listEntries("alice");
            for (int i = 1; i < listed.size(); i++) {
                assertFalse(listed.get(i).createdAt().isAfter(listed.get(i - 1).createdAt()));
            }
        }

        @Test
        @DisplayName("should delete the entry with its chunks but keep the graph")
        void shouldDeleteEntry() {
            journal.handleTurn("alice", "s1", "Maria and I argued about the budget again");
            SaveOutcome saved = journal.saveEntry("alice", "s1");
            int nodesBefore = journal.graphStats("alice").nodeCount();

            journal.deleteEntry("alice", saved.entryId());

            assertThrows(EntryNotFoundException.class, () -> journal.getEntry("alice", saved.entryId()));
            assertEquals(0, chunks.countByEntry("alice", saved.entryId()).join());
            assertEquals(nodesBefore, journal.graphStats("alice").nodeCount());
        }

        @Test
        @DisplayName("should report a missing entry")
        void shouldReportMissingEntry() {
            UUID unknown = UUID.randomUUID();

            assertThrows(EntryNotFoundException.class, () -> journal.getEntry("alice", unknown));
            assertThrows(EntryNotFoundException.class, () -> journal.deleteEntry("alice", unknown));
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("should require the model, storages and executor")
        void shouldRequireCollaborators() {
            assertThrows(IllegalStateException.class, () -> Journal.builder().build());
            assertThrows(IllegalStateException.class, () -> Journal.builder()
                .llmFunction(llm)
                .embeddingFunction(embeddings)
                .chunkStorage(chunks)
                .entryStorage(entries)
                .build());
        }

        @Test
        @DisplayName("should run without a graph when it is disabled")
        void shouldRunWithoutGraph() {
            Journal withoutGraph = Journal.builder()
                .settings(JournalSettings.defaults().withGraphEnabled(false).withRetryDelayMs(0))
                .llmFunction(llm)
                .embeddingFunction(embeddings)
                .chunkStorage(chunks)
                .entryStorage(entries)
                .graphStorage(graph)
                .executor(executor)
                .build();

            assertFalse(withoutGraph.isGraphEnabled());
            assertNull(withoutGraph.graphStats("alice"));

            withoutGraph.handleTurn("alice", "s1", "Work was long today");
            SaveOutcome saved = withoutGraph.saveEntry("alice", "s1");
            assertFalse(saved.graphUpdated());
            assertEquals(0, graph.getStats("alice").join().nodeCount());
        }
    }
}
