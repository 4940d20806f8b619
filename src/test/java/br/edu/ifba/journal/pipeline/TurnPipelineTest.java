package br.edu.ifba.journal.pipeline;

import br.edu.ifba.journal.context.ContextBudgeter;
import br.edu.ifba.journal.core.EntityType;
import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.IntentLabel;
import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.core.Valence;
import br.edu.ifba.journal.embedding.EmbeddingFunction;
import br.edu.ifba.journal.graph.KnowledgeGraphStore;
import br.edu.ifba.journal.nlu.ExtractionResponseParser;
import br.edu.ifba.journal.nlu.ExtractionStrategy;
import br.edu.ifba.journal.nlu.FactExtractor;
import br.edu.ifba.journal.nlu.GenerativeExtractionStrategy;
import br.edu.ifba.journal.nlu.LexicalEntityTagger;
import br.edu.ifba.journal.prompt.IntentRouter;
import br.edu.ifba.journal.prompt.PromptTemplates;
import br.edu.ifba.journal.prompt.ResponseFormatValidator;
import br.edu.ifba.journal.prompt.SelfAwarenessDetector;
import br.edu.ifba.journal.retrieval.SemanticRetriever;
import br.edu.ifba.journal.storage.impl.InMemoryChunkStorage;
import br.edu.ifba.journal.storage.impl.InMemoryGraphStorage;
import br.edu.ifba.journal.support.FakeEmbeddingFunction;
import br.edu.ifba.journal.support.ScriptedLlm;
import br.edu.ifba.journal.utils.RetryEventLogger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the read-path assembled from its four stages.
 *
 * <p>Tests cover:</p>
 * <ul>
 *   <li>State transitions on the happy path</li>
 *   <li>Degraded knowledge sources</li>
 *   <li>Search and extraction running side by side, each under its own time limit</li>
 *   <li>Generation failure, regeneration and flagged replies</li>
 *   <li>The greeting short-cut</li>
 * </ul>
 */
class TurnPipelineTest {

    private static final String GOOD_REPLY = "I hear you. What feels heaviest about it?";

    private static final String ANGRY_AT_MARIA = """
        {"entities": [{"name": "Maria", "type": "person"}],
         "emotions": [{"name": "anger", "valence": "negative", "intensity": 5}],
         "relationships": [], "intent": "emotional-release"}""";

    private ScriptedLlm llm;
    private FakeEmbeddingFunction embeddings;
    private InMemoryChunkStorage chunks;
    private InMemoryGraphStorage graphStorage;
    private ExecutorService executor;
    private RetryEventLogger retryEventLogger;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlm();
        embeddings = new FakeEmbeddingFunction();
        chunks = new InMemoryChunkStorage();
        chunks.initialize().join();
        graphStorage = new InMemoryGraphStorage();
        graphStorage.initialize().join();
        executor = Executors.newFixedThreadPool(4);
        retryEventLogger = new RetryEventLogger();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPathTests {

        @Test
        @DisplayName("should walk every state and reply for a user with no history")
        void shouldReplyWithoutHistory() {
            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertEquals(GOOD_REPLY, outcome.reply());
            assertFalse(outcome.flagged());
            assertFalse(outcome.graphAvailable());
            assertEquals(0, outcome.contextTokens());
            assertEquals(1, outcome.generationCalls());
            assertEquals(List.of("IDLE->RETRIEVING", "RETRIEVING->ROUTING", "ROUTING->GENERATING",
                "GENERATING->VALIDATING", "VALIDATING->DONE"), outcome.trace());
        }

        @Test
        @DisplayName("should bring past entries, graph memories and a gentle tone into the prompt")
        void shouldUseAllSources() {
            indexEntry("alice", "Maria took credit for my slides in the meeting");
            new KnowledgeGraphStore(graphStorage, 1000, 20).upsertFacts("alice", UUID.randomUUID(), new ExtractedFact(
                List.of(new ExtractedFact.Mention("Maria", EntityType.PERSON),
                        new ExtractedFact.Mention("Acme", EntityType.ORGANIZATION)),
                List.of(),
                List.of(new ExtractedFact.Relationship("Maria", "Acme", "works_at")),
                IntentLabel.GENERAL, "generative")).join();
            llm.respond(ScriptedLlm.Kind.EXTRACTION, ANGRY_AT_MARIA);

            TurnOutcome outcome = pipeline(true)
                .execute("alice", "Maria took credit for my work again and I am furious", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertTrue(outcome.graphAvailable());
            assertTrue(outcome.nluAvailable());
            assertTrue(outcome.contextTokens() > 0);

            String systemPrompt = llm.calls(ScriptedLlm.Kind.REPLY).get(0).systemPrompt();
            assertTrue(systemPrompt.contains("Maria took credit for my slides in the meeting"));
            assertTrue(systemPrompt.contains("- Maria works at Acme"));
            assertTrue(systemPrompt.contains("The user mentions Maria (person); seems to feel anger (negative, 5/5)."));
            assertTrue(systemPrompt.contains("Their emotions are intense right now"));
            assertTrue(systemPrompt.contains(PromptTemplates.intentGuidance(IntentLabel.EMOTIONAL_RELEASE)));
        }

        @Test
        @DisplayName("should send only the latest turns of the session as history")
        void shouldTrimHistory() {
            List<Turn> history = List.of(Turn.user("one"), Turn.assistant("two"), Turn.user("three"));

            pipeline(false, 2).execute("alice", "four", history).join();

            List<?> sent = llm.calls(ScriptedLlm.Kind.REPLY).get(0).history();
            assertEquals(2, sent.size());
        }

        @Test
        @DisplayName("should answer venting with a single short question and no advice list")
        void shouldKeepVentingReplyInFormat() {
            llm.queueReplies(
                "Here is what you can do:\n1. Talk to HR\n2. Keep notes of every meeting",
                "That sounds humiliating. What hurts most about it?");

            TurnOutcome outcome = pipeline(false).execute("alice",
                "I'm so angry at my boss, he keeps criticizing me in front of the team", List.of()).join();

            String reply = outcome.reply();
            assertFalse(outcome.flagged());
            assertTrue(new ResponseFormatValidator(50).check(reply).isValid());
            assertTrue(reply.chars().filter(c -> c == '?').count() <= 1);
            assertTrue(reply.split("\\s+").length < 50);
            assertFalse(reply.contains("\n1."));
        }
    }

    @Nested
    @DisplayName("Degraded sources")
    class DegradedTests {

        @Test
        @DisplayName("should still reply when embeddings and extraction are down")
        void shouldReplyWithoutSources() {
            embeddings.setFailing(true);
            llm.failing(ScriptedLlm.Kind.EXTRACTION, true);
            GenerativeExtractionStrategy onlyGenerative = new GenerativeExtractionStrategy(
                llm, new ExtractionResponseParser(new ObjectMapper()), () -> true, 2000, 4, retryEventLogger);

            TurnOutcome outcome = pipeline(new FactExtractor(List.of(onlyGenerative), 1000), true, 10)
                .execute("alice", "Saw Maria today", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertFalse(outcome.nluAvailable());
            assertFalse(outcome.graphAvailable());
            assertEquals(GOOD_REPLY, outcome.reply());
        }

        @Test
        @DisplayName("should fall back to lexical tagging when generative extraction fails")
        void shouldUseLexicalFallback() {
            llm.failing(ScriptedLlm.Kind.EXTRACTION, true);

            TurnOutcome outcome = pipeline(false).execute("alice", "I had coffee with Ana", List.of()).join();

            assertTrue(outcome.nluAvailable());
            assertTrue(llm.calls(ScriptedLlm.Kind.REPLY).get(0).systemPrompt().contains("Ana (person)"));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should run semantic search and extraction at the same time")
        void shouldRetrieveAndExtractConcurrently() throws Exception {
            indexEntry("alice", "Maria took credit for my slides in the meeting");
            CountDownLatch searchStarted = new CountDownLatch(1);
            CountDownLatch extractionStarted = new CountDownLatch(1);
            AtomicBoolean searchSawExtraction = new AtomicBoolean();
            AtomicBoolean extractionSawSearch = new AtomicBoolean();

            EmbeddingFunction waitingEmbeddings = new EmbeddingFunction() {
                @Override
                public CompletableFuture<List<float[]>> embed(@NotNull List<String> texts) {
                    return CompletableFuture.supplyAsync(() -> {
                        searchStarted.countDown();
                        searchSawExtraction.set(awaitQuietly(extractionStarted));
                        return texts.stream().map(FakeEmbeddingFunction::vectorOf).toList();
                    }, executor);
                }

                @Override
                @NotNull
                public String modelVersion() {
                    return embeddings.modelVersion();
                }
            };
            ExtractionStrategy waitingExtraction = new ExtractionStrategy() {
                @Override
                @NotNull
                public String name() {
                    return "waiting";
                }

                @Override
                public boolean isAvailable() {
                    return true;
                }

                @Override
                @NotNull
                public CompletableFuture<ExtractedFact> extract(@NotNull String text, @NotNull List<Turn> recentHistory) {
                    return CompletableFuture.supplyAsync(() -> {
                        extractionStarted.countDown();
                        extractionSawSearch.set(awaitQuietly(searchStarted));
                        return new ExtractedFact(List.of(new ExtractedFact.Mention("Maria", EntityType.PERSON)),
                            List.of(), List.of(), IntentLabel.GENERAL, "waiting");
                    }, executor);
                }
            };

            TurnOutcome outcome = pipeline(new SemanticRetriever(waitingEmbeddings, chunks, 3000),
                new FactExtractor(List.of(waitingExtraction), 3000), false, 10)
                .execute("alice", "Maria did it again", List.of())
                .get(10, TimeUnit.SECONDS);

            assertTrue(searchSawExtraction.get(), "search finished without extraction running alongside");
            assertTrue(extractionSawSearch.get(), "extraction finished without search running alongside");
            assertTrue(outcome.semanticAvailable());
            assertTrue(outcome.nluAvailable());
            assertEquals(GOOD_REPLY, outcome.reply());
            assertFalse(outcome.flagged());
        }

        @Test
        @DisplayName("should reply within the search time limit when embedding never answers")
        void shouldReplyWhenEmbeddingHangs() throws Exception {
            EmbeddingFunction hanging = new EmbeddingFunction() {
                @Override
                public CompletableFuture<List<float[]>> embed(@NotNull List<String> texts) {
                    return new CompletableFuture<>();
                }

                @Override
                @NotNull
                public String modelVersion() {
                    return embeddings.modelVersion();
                }
            };
            llm.respond(ScriptedLlm.Kind.EXTRACTION, ANGRY_AT_MARIA);

            long start = System.nanoTime();
            TurnOutcome outcome = pipeline(new SemanticRetriever(hanging, chunks, 100), extractor(), false, 10)
                .execute("alice", "Maria took credit for my work", List.of())
                .get(10, TimeUnit.SECONDS);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertEquals(TurnState.DONE, outcome.state());
            assertFalse(outcome.semanticAvailable());
            assertTrue(outcome.nluAvailable());
            assertEquals(GOOD_REPLY, outcome.reply());
            assertFalse(outcome.flagged());
            assertTrue(elapsedMs < 5000, "turn took " + elapsedMs + "ms");
        }

        @Test
        @DisplayName("should mark semantic search unavailable when embedding fails")
        void shouldMarkSemanticUnavailableOnFailure() {
            embeddings.setFailing(true);

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertFalse(outcome.semanticAvailable());
            assertEquals(GOOD_REPLY, outcome.reply());
        }

        @Test
        @DisplayName("should keep semantic search available when nothing similar is stored")
        void shouldKeepSemanticAvailableWhenEmpty() {
            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertTrue(outcome.semanticAvailable());
        }
    }

    @Nested
    @DisplayName("Generation and format")
    class GenerationTests {

        @Test
        @DisplayName("should end in FAILED with the static apology when generation stays down")
        void shouldApologiseWhenGenerationFails() {
            llm.failing(ScriptedLlm.Kind.REPLY, true);

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.FAILED, outcome.state());
            assertTrue(outcome.failed());
            assertEquals(PromptTemplates.STATIC_APOLOGY, outcome.reply());
            // first attempt plus one retry
            assertEquals(2, llm.calls(ScriptedLlm.Kind.REPLY).size());
            assertFalse(outcome.trace().contains("GENERATING->VALIDATING"));
        }

        @Test
        @DisplayName("should regenerate once with a correction and serve the conforming draft")
        void shouldRegenerateOnce() {
            llm.queueReplies("That sounds like a hard day.", "That sounds hard. What made it so draining?");

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertFalse(outcome.flagged());
            assertEquals("That sounds hard. What made it so draining?", outcome.reply());
            assertEquals(2, outcome.generationCalls());
            assertTrue(llm.calls(ScriptedLlm.Kind.REPLY).get(1).prompt().contains("Your previous reply broke the reply format"));
        }

        @Test
        @DisplayName("should serve the second draft flagged when it still breaks the format")
        void shouldFlagSecondViolation() {
            llm.queueReplies("Why? And how?", "What happened? Who was there?");

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertTrue(outcome.flagged());
            assertEquals("What happened? Who was there?", outcome.reply());
            assertEquals(2, outcome.generationCalls());
        }

        @Test
        @DisplayName("should keep the first draft flagged when regeneration fails")
        void shouldKeepFirstDraftWhenRegenerationFails() {
            AtomicInteger replies = new AtomicInteger();
            llm.on(ScriptedLlm.Kind.REPLY, prompt -> {
                if (replies.getAndIncrement() == 0) {
                    return "That sounds like a hard day.";
                }
                throw new IllegalStateException("model unavailable");
            });

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertTrue(outcome.flagged());
            assertEquals("That sounds like a hard day.", outcome.reply());
        }

        @Test
        @DisplayName("should never serve a blank reply")
        void shouldNotServeBlankReply() {
            llm.respond(ScriptedLlm.Kind.REPLY, "   ");

            TurnOutcome outcome = pipeline(false).execute("alice", "Work was long today", List.of()).join();

            assertEquals(TurnState.FAILED, outcome.state());
            assertEquals(PromptTemplates.STATIC_APOLOGY, outcome.reply());
        }

        @Test
        @DisplayName("should accept an acknowledgment when the message shows insight")
        void shouldAcknowledgeInsight() {
            llm.respond(ScriptedLlm.Kind.REPLY, "That's a real insight. Noticing it is the first part.");

            TurnOutcome outcome = pipeline(false)
                .execute("alice", "I realize I snap at people when I skip lunch", List.of()).join();

            assertEquals(TurnState.DONE, outcome.state());
            assertFalse(outcome.flagged());
            assertEquals(1, outcome.generationCalls());
        }
    }

    @Nested
    @DisplayName("Greetings")
    class GreetingTests {

        @Test
        @DisplayName("should answer a greeting with the static welcome when there are no entries")
        void shouldUseStaticGreeting() {
            TurnOutcome outcome = pipeline(false).execute("alice", "hi", List.of()).join();

            assertTrue(outcome.greeting());
            assertEquals(PromptTemplates.STATIC_GREETING, outcome.reply());
            assertTrue(llm.calls().isEmpty());
        }

        @Test
        @DisplayName("should personalise the greeting when past entries exist")
        void shouldPersonaliseGreeting() {
            indexEntry("alice", "hi there, the move to Lisbon went well");

            TurnOutcome outcome = pipeline(false).execute("alice", "hi", List.of()).join();

            assertTrue(outcome.greeting());
            assertEquals("Welcome back. How is the week going?", outcome.reply());
            assertTrue(llm.calls(ScriptedLlm.Kind.GREETING).get(0).prompt().contains("the move to Lisbon went well"));
            assertEquals(PromptTemplates.GREETING_SYSTEM_PROMPT, llm.calls(ScriptedLlm.Kind.GREETING).get(0).systemPrompt());
        }

        @Test
        @DisplayName("should fall back to the static welcome when the model fails")
        void shouldFallBackWhenGreetingFails() {
            indexEntry("alice", "hi there, the move to Lisbon went well");
            llm.failing(ScriptedLlm.Kind.GREETING, true);

            TurnOutcome outcome = pipeline(false).execute("alice", "good morning", List.of()).join();

            assertEquals(PromptTemplates.STATIC_GREETING, outcome.reply());
            assertEquals(TurnState.DONE, outcome.state());
        }
    }

    @Test
    @DisplayName("should require at least one stage")
    void shouldRequireStage() {
        assertThrows(IllegalStateException.class, () -> TurnPipeline.builder().build());
    }

    private TurnPipeline pipeline(boolean graphEnabled) {
        return pipeline(graphEnabled, 10);
    }

    private TurnPipeline pipeline(boolean graphEnabled, int historyTurns) {
        return pipeline(extractor(), graphEnabled, historyTurns);
    }

    private FactExtractor extractor() {
        List<ExtractionStrategy> strategies = List.of(
            new GenerativeExtractionStrategy(llm, new ExtractionResponseParser(new ObjectMapper()), () -> true, 2000, 4, retryEventLogger),
            new LexicalEntityTagger());
        return new FactExtractor(strategies, 1000);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private TurnPipeline pipeline(FactExtractor extractor, boolean graphEnabled, int historyTurns) {
        return pipeline(new SemanticRetriever(embeddings, chunks, 1000), extractor, graphEnabled, historyTurns);
    }

    private TurnPipeline pipeline(SemanticRetriever retriever, FactExtractor extractor, boolean graphEnabled, int historyTurns) {
        ContextBudgeter budgeter = new ContextBudgeter();
        ReplyGenerator generator = new ReplyGenerator(llm, retryEventLogger, 100, 0.7, historyTurns, 1, 0);
        KnowledgeGraphStore graphStore = graphEnabled ? new KnowledgeGraphStore(graphStorage, 1000, 20) : null;

        return TurnPipeline.builder()
            .addStage(new RetrieveStage(retriever, extractor, graphStore, executor, 5, 1, 4))
            .addStage(new RouteStage(new IntentRouter(4, 0.6, new SelfAwarenessDetector()), budgeter, 1500))
            .addStage(new GenerateStage(generator, 50))
            .addStage(new ValidateStage(generator, new ResponseFormatValidator(50), retryEventLogger))
            .greetingResponder(new GreetingResponder(retriever, budgeter, llm, 1500))
            .build();
    }

    private void indexEntry(String owner, String summary) {
        Entry entry = new Entry(UUID.randomUUID(), owner, summary, List.of(Turn.user(summary)), Instant.now());
        new SemanticRetriever(embeddings, chunks, 1000).index(entry, List.of(summary)).join();
    }
}
