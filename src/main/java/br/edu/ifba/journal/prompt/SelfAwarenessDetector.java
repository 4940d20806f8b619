package br.edu.ifba.journal.prompt;

import java.util.List;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * Scores how much insight a message already shows, from 0 (none) to 1.
 *
 * <p>Phrases of realisation ("I realize", "I've learned") weigh more than phrases of observation
 * ("I noticed", "looking back"). The score is the capped sum of the weights found.</p>
 */
public class SelfAwarenessDetector {

    static final double STRONG_WEIGHT = 0.6;
    static final double WEAK_WEIGHT = 0.3;

    private static final List<String> STRONG_MARKERS = List.of(
        "i realize", "i realise", "i realized", "i realised", "i've realized", "i've realised",
        "i now understand", "i understand now", "i've learned", "i have learned", "i learned that",
        "i recognize", "i recognise", "i can see now", "i see now that", "it finally clicked"
    );

    private static final List<String> WEAK_MARKERS = List.of(
        "i noticed", "i've noticed", "looking back", "because i", "pattern", "i think it's because",
        "the reason i", "i tend to", "i'm aware", "i am aware", "i know that i", "i keep doing",
        "in hindsight"
    );

    public double score(@NotNull String message) {
        String text = message.toLowerCase(Locale.ROOT).replace('’', '\'');
        double score = 0.0;
        for (String marker : STRONG_MARKERS) {
            if (text.contains(marker)) {
                score += STRONG_WEIGHT;
            }
        }
        for (String marker : WEAK_MARKERS) {
            if (text.contains(marker)) {
                score += WEAK_WEIGHT;
            }
        }
        return Math.min(1.0, score);
    }
}
