package br.edu.ifba.journal.core;

import java.util.Locale;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Polarity of an emotion. Closed set: anything else is rejected by validation.
 */
public enum Valence {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    @NotNull
    public static Optional<Valence> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @NotNull
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
