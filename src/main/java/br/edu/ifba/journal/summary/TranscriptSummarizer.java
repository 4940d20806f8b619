package br.edu.ifba.journal.summary;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Turn;
import br.edu.ifba.journal.llm.LLMFunction;

/**
 * Condenses a session transcript into the short summary stored with the entry.
 *
 * <p>Summaries are capped at {@value #MAX_SUMMARY_CHARS} characters. When the model cannot be
 * used the first user message stands in for the summary, so summarising never fails.</p>
 */
public class TranscriptSummarizer {

    private static final Logger logger = LoggerFactory.getLogger(TranscriptSummarizer.class);

    static final int MAX_SUMMARY_CHARS = 200;
    static final int MAX_FALLBACK_CHARS = 100;
    static final int MAX_OUTPUT_TOKENS = 150;
    static final double TEMPERATURE = 0.7;

    static final String EMPTY_FALLBACK = "A journaling conversation was recorded.";

    private static final String SYSTEM_PROMPT =
        "You are a helpful assistant that writes concise, empathetic summaries of journaling conversations.";

    private static final String SUMMARY_TEMPLATE = """
        Summarize this journaling conversation in 2-3 sentences, capturing the key themes, emotions
        and insights. Focus on what the user shared about their thoughts, feelings or experiences.

        Conversation:
        %s

        Summary:""";

    private final LLMFunction llmFunction;
    private final long timeoutMs;

    public TranscriptSummarizer(@NotNull LLMFunction llmFunction, long timeoutMs) {
        this.llmFunction = llmFunction;
        this.timeoutMs = timeoutMs;
    }

    @NotNull
    public String summarize(@NotNull List<Turn> transcript) {
        StringBuilder conversation = new StringBuilder();
        for (Turn turn : transcript) {
            conversation.append(turn.transcriptLine()).append('\n');
        }

        try {
            String summary = llmFunction.apply(
                    String.format(SUMMARY_TEMPLATE, conversation.toString().strip()),
                    SYSTEM_PROMPT,
                    null,
                    Map.of(LLMFunction.MAX_TOKENS, MAX_OUTPUT_TOKENS, LLMFunction.TEMPERATURE, TEMPERATURE))
                .copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .join();
            if (summary == null || summary.isBlank()) {
                logger.warn("Summary model returned nothing, using fallback summary");
                return fallback(transcript);
            }
            return cap(summary.strip());
        } catch (RuntimeException e) {
            logger.warn("Summary generation failed, using fallback summary: {}", e.getMessage());
            return fallback(transcript);
        }
    }

    @NotNull
    static String cap(@NotNull String summary) {
        if (summary.length() <= MAX_SUMMARY_CHARS) {
            return summary;
        }
        return summary.substring(0, MAX_SUMMARY_CHARS - 3) + "...";
    }

    /**
     * The first user message, shortened to {@value #MAX_FALLBACK_CHARS} characters.
     */
    @NotNull
    static String fallback(@NotNull List<Turn> transcript) {
        for (Turn turn : transcript) {
            if (turn.speaker() == Turn.Speaker.USER && !turn.content().isBlank()) {
                String first = turn.content().strip();
                return first.length() > MAX_FALLBACK_CHARS
                    ? first.substring(0, MAX_FALLBACK_CHARS - 3) + "..."
                    : first;
            }
        }
        return EMPTY_FALLBACK;
    }
}
