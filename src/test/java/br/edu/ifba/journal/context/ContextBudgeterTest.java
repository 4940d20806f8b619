package br.edu.ifba.journal.context;

import br.edu.ifba.journal.core.Chunk;
import br.edu.ifba.journal.core.EntityType;
import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.core.IntentLabel;
import br.edu.ifba.journal.core.ScoredChunk;
import br.edu.ifba.journal.core.Valence;
import br.edu.ifba.journal.utils.TokenUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ContextBudgeter}.
 *
 * <p>Covers priority order, suffix dropping under a tight budget, the always-kept current
 * reading and rendering of the sections.</p>
 */
class ContextBudgeterTest {

    private static final Instant MARCH = Instant.parse("2024-03-01T10:00:00Z");

    private ContextBudgeter budgeter;

    @BeforeEach
    void setUp() {
        budgeter = new ContextBudgeter();
    }

    @Nested
    @DisplayName("Priority")
    class PriorityTests {

        @Test
        @DisplayName("should order current reading, then snippets by score, then graph facts by hops")
        void shouldOrderByPriority() {
            List<ScoredChunk> semantic = List.of(scored("Slept badly again", 0.4), scored("Argued with Maria", 0.9));
            List<GraphFact> graph = List.of(
                new GraphFact("Maria", "Maria", "works_at", "Acme", "ENTITY", 2),
                new GraphFact("Maria", "Maria", "mentioned_with", "Joao", "PERSON", 1));

            ContextBlock block = budgeter.assemble(semantic, graph, angryAboutMaria(), 1500);

            List<ContextItem> items = block.included();
            assertEquals(5, items.size());
            assertEquals(ContextItem.Kind.CURRENT, items.get(0).kind());
            assertTrue(items.get(1).content().endsWith("Argued with Maria"));
            assertTrue(items.get(2).content().endsWith("Slept badly again"));
            assertEquals("- Maria mentioned with Joao", items.get(3).content());
            assertEquals("- Maria works at Acme", items.get(4).content());
            assertTrue(block.dropped().isEmpty());
        }

        @Test
        @DisplayName("should render snippets with their date")
        void shouldRenderDate() {
            ContextBlock block = budgeter.assemble(List.of(scored("Long walk by the sea", 0.8)), List.of(),
                ExtractedFact.empty(), 1500);

            assertEquals("- March 01, 2024: Long walk by the sea", block.included().get(0).content());
            assertTrue(block.text().startsWith(ContextFormatter.SEMANTIC_HEADER));
            assertTrue(block.text().contains(ContextFormatter.SEMANTIC_FOOTER));
        }

        @Test
        @DisplayName("should produce an empty block when every source is empty")
        void shouldBeEmptyWithoutSources() {
            ContextBlock block = budgeter.assemble(List.of(), List.of(), ExtractedFact.empty(), 1500);

            assertTrue(block.isEmpty());
            assertEquals("", block.text());
            assertEquals(0, block.totalTokens());
        }
    }

    @Nested
    @DisplayName("Budget")
    class BudgetTests {

        @Test
        @DisplayName("should stay within the budget and drop a suffix of the priority order")
        void shouldDropSuffix() {
            List<ScoredChunk> semantic = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                semantic.add(scored("Entry number " + i + " about work stress and long evenings at the office", 0.9 - i * 0.05));
            }

            ContextBlock full = budgeter.assemble(semantic, List.of(), ExtractedFact.empty(), 10_000);
            int oneItem = full.included().get(0).tokens();
            ContextBlock tight = budgeter.assemble(semantic, List.of(), ExtractedFact.empty(), oneItem * 5);

            assertTrue(tight.totalTokens() <= oneItem * 5);
            assertTrue(tight.included().size() > 1 && tight.included().size() < 10);
            assertEquals(full.included().subList(0, tight.included().size()), tight.included());
            assertEquals(10, tight.included().size() + tight.dropped().size());
        }

        @Test
        @DisplayName("should not let a later small item jump over a dropped larger one")
        void shouldNotSkipOverDroppedItem() {
            ScoredChunk large = scored("A very long reflection about family dinners, old arguments, new jobs and how "
                + "everything seemed to pile up at once during the spring", 0.9);
            GraphFact small = new GraphFact("Ana", "Ana", "knows", "Bia", "PERSON", 1);
            int smallTokens = TokenUtil.estimateTokens(ContextFormatter.graphLine(small));

            ContextBlock block = budgeter.assemble(List.of(large), List.of(small), ExtractedFact.empty(), smallTokens);

            assertTrue(block.isEmpty());
            assertEquals(2, block.dropped().size());
        }

        @Test
        @DisplayName("should count section headers and the footer against the budget")
        void shouldCountHeadersAndFooter() {
            ScoredChunk snippet = scored("Argued with Maria about the slides", 0.9);
            int lineTokens = TokenUtil.estimateTokens(ContextFormatter.semanticLine(snippet));

            ContextBlock lineOnly = budgeter.assemble(List.of(snippet), List.of(), ExtractedFact.empty(), lineTokens);

            assertTrue(lineOnly.isEmpty());
            assertEquals("", lineOnly.text());

            int renderedTokens = TokenUtil.estimateTokens(
                budgeter.assemble(List.of(snippet), List.of(), ExtractedFact.empty(), 1500).text());
            ContextBlock exact = budgeter.assemble(List.of(snippet), List.of(), ExtractedFact.empty(), renderedTokens);

            assertEquals(1, exact.included().size());
            assertEquals(renderedTokens, exact.totalTokens());
        }

        @Test
        @DisplayName("should keep the rendered text within every budget the current reading fits")
        void shouldKeepRenderedTextWithinBudget() {
            List<ScoredChunk> semantic = List.of(
                scored("Argued with Maria about the slides", 0.9),
                scored("Slept badly again", 0.7),
                scored("Long walk by the sea with Joao", 0.5));
            List<GraphFact> graph = List.of(
                new GraphFact("Maria", "Maria", "works_at", "Acme", "ENTITY", 1),
                new GraphFact("Maria", "Maria", "mentioned_with", "Joao", "PERSON", 2));
            int readingTokens = TokenUtil.estimateTokens(
                budgeter.assemble(List.of(), List.of(), angryAboutMaria(), 1500).text());

            for (int max = readingTokens; max <= 300; max++) {
                ContextBlock block = budgeter.assemble(semantic, graph, angryAboutMaria(), max);

                int rendered = TokenUtil.estimateTokens(block.text());
                assertTrue(rendered <= max, "rendered " + rendered + " tokens for a budget of " + max);
                assertEquals(rendered, block.totalTokens());
            }
        }

        @Test
        @DisplayName("should keep the current reading even past the budget")
        void shouldKeepCurrentReading() {
            ContextBlock block = budgeter.assemble(List.of(scored("Anything", 0.5)), List.of(), angryAboutMaria(), 0);

            assertEquals(1, block.included().size());
            assertEquals(ContextItem.Kind.CURRENT, block.included().get(0).kind());
            assertEquals("The user mentions Maria (person); seems to feel anger (negative, 4/5).",
                block.included().get(0).content());
        }

        @Test
        @DisplayName("should reject a negative budget")
        void shouldRejectNegativeBudget() {
            assertThrows(IllegalArgumentException.class,
                () -> budgeter.assemble(List.of(), List.of(), ExtractedFact.empty(), -1));
        }
    }

    private static ExtractedFact angryAboutMaria() {
        return new ExtractedFact(
            List.of(new ExtractedFact.Mention("Maria", EntityType.PERSON)),
            List.of(new ExtractedFact.Emotion("anger", Valence.NEGATIVE, 4)),
            List.of(),
            IntentLabel.EMOTIONAL_RELEASE,
            "generative");
    }

    private static ScoredChunk scored(String text, double similarity) {
        Chunk chunk = new Chunk(UUID.randomUUID(), UUID.randomUUID(), "owner", text, new float[] {1f}, "v1", MARCH);
        return new ScoredChunk(chunk, similarity);
    }
}
