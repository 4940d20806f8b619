package br.edu.ifba.journal.nlu;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.IntentLabel;
import br.edu.ifba.journal.core.Turn;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FactExtractor} fallback order.
 */
class FactExtractorTest {

    @Test
    @DisplayName("should use the first strategy that succeeds")
    void shouldUseFirstStrategy() {
        StubStrategy first = StubStrategy.answering("first");
        StubStrategy second = StubStrategy.answering("second");

        ExtractedFact fact = new FactExtractor(List.of(first, second), 1000).extract("Busy day", List.of());

        assertEquals("first", fact.extractedBy());
        assertEquals(0, second.calls.get());
    }

    @Test
    @DisplayName("should fall back when a strategy fails")
    void shouldFallBackOnFailure() {
        StubStrategy failing = new StubStrategy("failing", true,
            () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));

        ExtractedFact fact = new FactExtractor(List.of(failing, new LexicalEntityTagger()), 1000)
            .extract("I had coffee with Ana", List.of());

        assertEquals(LexicalEntityTagger.NAME, fact.extractedBy());
        assertEquals(List.of("Ana"), fact.entityNames());
    }

    @Test
    @DisplayName("should fall back when a strategy throws instead of returning a future")
    void shouldFallBackOnThrow() {
        StubStrategy throwing = new StubStrategy("throwing", true, () -> {
            throw new IllegalStateException("sync failure");
        });

        ExtractedFact fact = new FactExtractor(List.of(throwing, StubStrategy.answering("next")), 1000)
            .extract("text", List.of());

        assertEquals("next", fact.extractedBy());
    }

    @Test
    @DisplayName("should fall back when a strategy exceeds its time limit")
    void shouldFallBackOnTimeout() {
        StubStrategy hanging = new StubStrategy("hanging", true, CompletableFuture::new);

        ExtractedFact fact = new FactExtractor(List.of(hanging, StubStrategy.answering("next")), 50)
            .extract("text", List.of());

        assertEquals("next", fact.extractedBy());
    }

    @Test
    @DisplayName("should skip unavailable strategies without calling them")
    void shouldSkipUnavailable() {
        StubStrategy unavailable = new StubStrategy("down", false,
            () -> CompletableFuture.completedFuture(ExtractedFact.empty()));

        ExtractedFact fact = new FactExtractor(List.of(unavailable, StubStrategy.answering("next")), 1000)
            .extract("text", List.of());

        assertEquals("next", fact.extractedBy());
        assertEquals(0, unavailable.calls.get());
    }

    @Test
    @DisplayName("should return the empty reading when every strategy fails or the text is blank")
    void shouldReturnEmptyReading() {
        StubStrategy failing = new StubStrategy("failing", true,
            () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        FactExtractor extractor = new FactExtractor(List.of(failing), 1000);

        assertEquals(ExtractedFact.NONE, extractor.extract("text", List.of()).extractedBy());
        assertEquals(ExtractedFact.NONE, extractor.extract("  ", List.of()).extractedBy());
    }

    @Test
    @DisplayName("should require at least one strategy")
    void shouldRequireStrategy() {
        assertThrows(IllegalArgumentException.class, () -> new FactExtractor(List.of(), 1000));
    }

    private static final class StubStrategy implements ExtractionStrategy {

        private final String name;
        private final boolean available;
        private final java.util.function.Supplier<CompletableFuture<ExtractedFact>> answer;
        private final AtomicInteger calls = new AtomicInteger();

        StubStrategy(String name, boolean available, java.util.function.Supplier<CompletableFuture<ExtractedFact>> answer) {
            this.name = name;
            this.available = available;
            this.answer = answer;
        }

        static StubStrategy answering(String name) {
            return new StubStrategy(name, true, () -> CompletableFuture.completedFuture(
                new ExtractedFact(List.of(), List.of(), List.of(), IntentLabel.GENERAL, name)));
        }

        @Override
        @NotNull
        public String name() {
            return name;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        @NotNull
        public CompletableFuture<ExtractedFact> extract(@NotNull String text, @NotNull List<Turn> recentHistory) {
            calls.incrementAndGet();
            return answer.get();
        }
    }
}
