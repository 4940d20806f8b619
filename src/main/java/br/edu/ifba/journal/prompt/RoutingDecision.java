package br.edu.ifba.journal.prompt;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.journal.core.IntentLabel;

/**
 * How the next reply should be shaped.
 *
 * @param intent selects the intent template
 * @param tone gentle for intense emotions, direct otherwise
 * @param mode probe with one question, or acknowledge the insight shown
 * @param selfAwareness the self-awareness score the mode was decided on
 */
public record RoutingDecision(
    @NotNull IntentLabel intent,
    @NotNull Tone tone,
    @NotNull Mode mode,
    double selfAwareness
) {

    public enum Tone {
        GENTLE,
        DIRECT
    }

    public enum Mode {
        PROBE,
        ACKNOWLEDGE
    }

    public boolean acknowledges() {
        return mode == Mode.ACKNOWLEDGE;
    }
}
