package br.edu.ifba.journal.nlu;

import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.Turn;

/**
 * Prompts for generative extraction of journaling facts.
 */
public final class ExtractionPrompts {

    private ExtractionPrompts() {
    }

    public static final String SYSTEM_PROMPT = """
        You are an expert in reflective journaling entity extraction.
        Return ONLY a valid JSON object (not an array). Do not use markdown code blocks.
        Return the raw JSON object starting with { and ending with }.
        """;

    public static final String EXTRACTION_TEMPLATE = """
        Extract structured data from the journal text below.

        - entities: people, organizations, places, topics and events mentioned. Each has "name" and
          "type", where type is one of: person, organization, place, topic, event.
        - emotions: each has "name" (emotion word), "valence" (positive, negative or neutral) and
          "intensity" (integer from 1 to 5).
        - relationships: connections between the entities above. Each has "source" and "target"
          (exact entity names) and "type", a short relation phrase such as "works at" or "lives with".
        - intent: exactly one of "self-reflection", "planning", "emotional-release",
          "insight-generation", "general".

        Return a JSON OBJECT with this exact structure:
        {
          "entities": [{"name": "Chloe", "type": "person"}],
          "emotions": [{"name": "anxiety", "valence": "negative", "intensity": 4}],
          "relationships": [{"source": "Chloe", "target": "Apple", "type": "works at"}],
          "intent": "emotional-release"
        }
        %s
        Text: %s

        Return ONLY the JSON object, no markdown, no code blocks, no other text:""";

    public static final String STRICT_INSTRUCTION = """

        Your previous answer was rejected: %s
        Follow the structure exactly. Use only the listed entity types and valences, integer
        intensities from 1 to 5, and one of the five intent labels. Output nothing but the JSON object.""";

    /**
     * Builds the user prompt, quoting recent conversation turns when there are any.
     */
    @NotNull
    public static String userPrompt(@NotNull String text, @NotNull List<Turn> recentHistory) {
        String history = "";
        if (!recentHistory.isEmpty()) {
            StringBuilder sb = new StringBuilder("\nRecent conversation, for context only:\n");
            for (Turn turn : recentHistory) {
                sb.append(turn.transcriptLine()).append('\n');
            }
            history = sb.toString();
        }
        return String.format(EXTRACTION_TEMPLATE, history, text);
    }

    /**
     * Appends the stricter instruction used for the single retry after a rejected answer.
     */
    @NotNull
    public static String strictPrompt(@NotNull String userPrompt, @NotNull List<String> problems) {
        return userPrompt + String.format(STRICT_INSTRUCTION, String.join("; ", problems));
    }
}
