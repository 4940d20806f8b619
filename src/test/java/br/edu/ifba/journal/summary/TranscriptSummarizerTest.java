package br.edu.ifba.journal.summary;

import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.llm.LLMFunction;
import br.edu.ifba.journal.support.ScriptedLlm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TranscriptSummarizer}.
 */
class TranscriptSummarizerTest {

    private static final List<Turn> TRANSCRIPT = List.of(
        Turn.user("My manager yelled at me in front of everyone"),
        Turn.assistant("That sounds humiliating. What went through your mind?"));

    @Test
    @DisplayName("should summarise with the transcript in the prompt")
    void shouldSummarise() {
        ScriptedLlm llm = new ScriptedLlm().respond(ScriptedLlm.Kind.SUMMARY, "  The user felt humiliated at work.  ");

        String summary = new TranscriptSummarizer(llm, 1000).summarize(TRANSCRIPT);

        assertEquals("The user felt humiliated at work.", summary);
        ScriptedLlm.Call call = llm.calls(ScriptedLlm.Kind.SUMMARY).get(0);
        assertTrue(call.prompt().contains("User: My manager yelled at me in front of everyone"));
        assertEquals(TranscriptSummarizer.MAX_OUTPUT_TOKENS, call.kwargs().get(LLMFunction.MAX_TOKENS));
    }

    @Test
    @DisplayName("should cap long summaries")
    void shouldCapSummary() {
        ScriptedLlm llm = new ScriptedLlm().respond(ScriptedLlm.Kind.SUMMARY, "x".repeat(500));

        String summary = new TranscriptSummarizer(llm, 1000).summarize(TRANSCRIPT);

        assertEquals(TranscriptSummarizer.MAX_SUMMARY_CHARS, summary.length());
        assertTrue(summary.endsWith("..."));
    }

    @Test
    @DisplayName("should fall back to the first user message when the model fails")
    void shouldFallBackOnFailure() {
        ScriptedLlm llm = new ScriptedLlm().failing(ScriptedLlm.Kind.SUMMARY, true);

        assertEquals("My manager yelled at me in front of everyone",
            new TranscriptSummarizer(llm, 1000).summarize(TRANSCRIPT));
    }

    @Test
    @DisplayName("should fall back when the model exceeds the time limit or answers blank")
    void shouldFallBackOnTimeoutOrBlank() {
        LLMFunction hanging = (prompt, system, history, kwargs) -> new CompletableFuture<>();
        ScriptedLlm blank = new ScriptedLlm().respond(ScriptedLlm.Kind.SUMMARY, " ");

        assertEquals("My manager yelled at me in front of everyone",
            new TranscriptSummarizer(hanging, 50).summarize(TRANSCRIPT));
        assertEquals("My manager yelled at me in front of everyone",
            new TranscriptSummarizer(blank, 1000).summarize(TRANSCRIPT));
    }

    @Test
    @DisplayName("should shorten a long first message and use a fixed text without user turns")
    void shouldShapeFallback() {
        String fallback = TranscriptSummarizer.fallback(List.of(Turn.user("y".repeat(300))));

        assertEquals(TranscriptSummarizer.MAX_FALLBACK_CHARS, fallback.length());
        assertEquals(TranscriptSummarizer.EMPTY_FALLBACK,
            TranscriptSummarizer.fallback(List.of(Turn.assistant("Welcome back."))));
    }
}
