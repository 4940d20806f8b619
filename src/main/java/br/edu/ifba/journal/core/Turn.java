package br.edu.ifba.journal.core;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One utterance in a journaling session.
 *
 * @param speaker who said it
 * @param content what was said
 */
public record Turn(
    @JsonProperty("speaker") @NotNull Speaker speaker,
    @JsonProperty("content") @NotNull String content
) {

    public Turn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static Turn user(@NotNull String content) {
        return new Turn(Speaker.USER, content);
    }

    public static Turn assistant(@NotNull String content) {
        return new Turn(Speaker.ASSISTANT, content);
    }

    /**
     * Transcript line as stored with the entry, e.g. {@code "User: I slept badly"}.
     */
    @NotNull
    public String transcriptLine() {
        return speaker.label() + ": " + content;
    }

    public enum Speaker {
        USER("User"),
        ASSISTANT("Assistant");

        private final String label;

        Speaker(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
