package br.edu.ifba.journal.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Structured reading of a piece of text: who and what is mentioned, how the writer feels and what
 * they are trying to do. Produced fresh per turn or per entry and never persisted as-is.
 *
 * @param entities typed named things mentioned in the text
 * @param emotions emotions with closed valence and a 1-5 intensity
 * @param relationships directed relations between mentioned entities
 * @param intent coarse purpose of the text
 * @param extractedBy name of the strategy that produced this reading
 */
public record ExtractedFact(
    @NotNull List<Mention> entities,
    @NotNull List<Emotion> emotions,
    @NotNull List<Relationship> relationships,
    @NotNull IntentLabel intent,
    @NotNull String extractedBy
) {

    public static final String NONE = "none";

    public ExtractedFact {
        entities = List.copyOf(entities);
        emotions = List.copyOf(emotions);
        relationships = List.copyOf(relationships);
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(extractedBy, "extractedBy must not be null");
    }

    /**
     * Reading used when nothing could be extracted.
     */
    @NotNull
    public static ExtractedFact empty() {
        return new ExtractedFact(List.of(), List.of(), List.of(), IntentLabel.GENERAL, NONE);
    }

    public boolean hasEntities() {
        return !entities.isEmpty();
    }

    public boolean isEmpty() {
        return entities.isEmpty() && emotions.isEmpty() && relationships.isEmpty();
    }

    @NotNull
    public List<String> entityNames() {
        List<String> names = new ArrayList<>(entities.size());
        for (Mention mention : entities) {
            names.add(mention.name());
        }
        return names;
    }

    /**
     * The strongest emotion, if any was read.
     */
    @NotNull
    public Optional<Emotion> dominantEmotion() {
        return emotions.stream().max(Comparator.comparingInt(Emotion::intensity));
    }

    public int maxIntensity() {
        return dominantEmotion().map(Emotion::intensity).orElse(0);
    }

    /**
     * A named thing mentioned in text.
     */
    public record Mention(@NotNull String name, @NotNull EntityType type) {
        public Mention {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /**
     * An emotion reading. Intensity is on a fixed 1 to 5 scale.
     */
    public record Emotion(@NotNull String name, @NotNull Valence valence, int intensity) {

        public static final int MIN_INTENSITY = 1;
        public static final int MAX_INTENSITY = 5;

        public Emotion {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(valence, "valence must not be null");
            if (intensity < MIN_INTENSITY || intensity > MAX_INTENSITY) {
                throw new IllegalArgumentException(
                    "intensity must be within [1, 5], got " + intensity);
            }
        }
    }

    /**
     * A directed relation between two mentioned entities. The type is a short free-form label.
     */
    public record Relationship(@NotNull String source, @NotNull String target, @NotNull String type) {
        public Relationship {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }
}
