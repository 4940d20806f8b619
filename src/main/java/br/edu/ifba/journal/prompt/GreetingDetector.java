package br.edu.ifba.journal.prompt;

import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/**
 * Recognises short opening greetings such as "hi" or "good morning!".
 */
public final class GreetingDetector {

    static final int MAX_WORDS = 3;

    private static final Pattern GREETING = Pattern.compile(
        "\\b(hello|hi|hey|greetings|good morning|good afternoon|good evening|sup|what'?s up)\\b");

    private GreetingDetector() {
    }

    /**
     * True for messages of at most three words containing a greeting word.
     */
    public static boolean isGreeting(@NotNull String message) {
        String text = message.strip().toLowerCase(Locale.ROOT).replace('’', '\'');
        if (text.isEmpty() || text.split("\\s+").length > MAX_WORDS) {
            return false;
        }
        return GREETING.matcher(text).find();
    }
}
