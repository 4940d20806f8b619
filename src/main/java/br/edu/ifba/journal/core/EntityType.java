package br.edu.ifba.journal.core;

import java.util.Locale;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Coarse categories an extracted entity may carry.
 */
public enum EntityType {
    PERSON,
    ORGANIZATION,
    PLACE,
    TOPIC,
    EVENT;

    /**
     * Parses a label such as {@code "person"} or {@code "Organization"}.
     *
     * @return the type, or empty when the label is not one of the enumerated categories
     */
    @NotNull
    public static Optional<EntityType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
