package br.edu.ifba.journal.context;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.ExtractedFact;
import br.edu.ifba.journal.core.GraphFact;
import br.edu.ifba.journal.core.ScoredChunk;

/**
 * Renders context items and assembles them into the text placed in the system prompt.
 */
public final class ContextFormatter {

    static final String SEMANTIC_HEADER = "You previously discussed with this user:";
    static final String SEMANTIC_FOOTER =
        "Use this context subtly and naturally in your response, but don't over-reference it.";
    static final String GRAPH_HEADER = "Related memories:";
    static final String CURRENT_HEADER = "Current message reading:";

    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private ContextFormatter() {
    }

    @NotNull
    public static String semanticLine(@NotNull ScoredChunk scored) {
        return "- " + DATE_FORMAT.format(scored.chunk().createdAt()) + ": " + scored.chunk().text();
    }

    @NotNull
    public static String graphLine(@NotNull GraphFact fact) {
        return "- " + fact.describe();
    }

    /**
     * One paragraph describing the current message, or an empty string when nothing was read.
     */
    @NotNull
    public static String currentReading(@NotNull ExtractedFact fact) {
        List<String> parts = new ArrayList<>();
        if (!fact.entities().isEmpty()) {
            List<String> names = new ArrayList<>();
            for (ExtractedFact.Mention mention : fact.entities()) {
                names.add(mention.name() + " (" + mention.type().name().toLowerCase(Locale.ROOT) + ")");
            }
            parts.add("mentions " + String.join(", ", names));
        }
        if (!fact.emotions().isEmpty()) {
            List<String> feelings = new ArrayList<>();
            for (ExtractedFact.Emotion emotion : fact.emotions()) {
                feelings.add(emotion.name() + " (" + emotion.valence().label() + ", " + emotion.intensity() + "/5)");
            }
            parts.add("seems to feel " + String.join(", ", feelings));
        }
        if (parts.isEmpty()) {
            return "";
        }
        return "The user " + String.join("; ", parts) + ".";
    }

    /**
     * Joins the included items into sections: past entries, related memories, current reading.
     */
    @NotNull
    public static String render(@NotNull List<ContextItem> included) {
        List<String> semantic = new ArrayList<>();
        List<String> graph = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (ContextItem item : included) {
            switch (item.kind()) {
                case SEMANTIC -> semantic.add(item.content());
                case GRAPH -> graph.add(item.content());
                case CURRENT -> current.add(item.content());
            }
        }

        List<String> sections = new ArrayList<>();
        if (!semantic.isEmpty()) {
            sections.add(SEMANTIC_HEADER + "\n" + String.join("\n", semantic) + "\n\n" + SEMANTIC_FOOTER);
        }
        if (!graph.isEmpty()) {
            sections.add(GRAPH_HEADER + "\n" + String.join("\n", graph));
        }
        if (!current.isEmpty()) {
            sections.add(CURRENT_HEADER + "\n" + String.join("\n", current));
        }
        return String.join("\n\n", sections);
    }
}
