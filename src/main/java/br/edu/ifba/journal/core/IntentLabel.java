package br.edu.ifba.journal.core;

import java.util.Locale;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Coarse purpose of a message, used to pick the reply template.
 */
public enum IntentLabel {
    SELF_REFLECTION("self-reflection"),
    PLANNING("planning"),
    EMOTIONAL_RELEASE("emotional-release"),
    INSIGHT_GENERATION("insight-generation"),
    GENERAL("general");

    private final String label;

    IntentLabel(String label) {
        this.label = label;
    }

    @NotNull
    public String label() {
        return label;
    }

    /**
     * Exact match on the hyphenated label, case-insensitive. Underscores are accepted in place of
     * hyphens.
     */
    @NotNull
    public static Optional<IntentLabel> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (IntentLabel intent : values()) {
            if (intent.label.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
