package br.edu.ifba.journal.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.jetbrains.annotations.NotNull;

/**
 * Checks replies against the reply format contract.
 *
 * <p>A conforming reply:</p>
 * <ul>
 *   <li>asks exactly one question, or asks none and contains an acknowledgment phrase</li>
 *   <li>has fewer words than the ceiling</li>
 *   <li>has no bulleted or numbered list and no "first ... second ..." step sequence</li>
 * </ul>
 */
public class ResponseFormatValidator {

    /**
     * Phrases that count as an explicit acknowledgment. The acknowledge template asks the model to
     * use one of them.
     */
    public static final List<String> ACKNOWLEDGMENT_PHRASES = List.of(
        "that's a real insight",
        "that's a meaningful realization",
        "that shows real self-awareness",
        "you've clearly thought about this",
        "it sounds like you've figured out",
        "you're seeing this clearly",
        "that's an important thing to notice",
        "that's real growth"
    );

    private static final Pattern LIST_LINE = Pattern.compile("(?m)^\\s*(?:[-*•]|\\d+[.)])\\s+\\S");
    private static final Pattern STEP_SEQUENCE = Pattern.compile(
        "\\b(?:first(?:ly)?|step 1|step one)\\b[\\s\\S]*\\b(?:second(?:ly)?|step 2|step two)\\b",
        Pattern.CASE_INSENSITIVE);

    private final int wordCeiling;

    public ResponseFormatValidator(int wordCeiling) {
        this.wordCeiling = wordCeiling;
    }

    @NotNull
    public FormatCheck check(@NotNull String reply) {
        String text = reply.strip();
        if (text.isEmpty()) {
            return new FormatCheck(List.of(FormatCheck.Violation.EMPTY), 0, 0);
        }

        List<FormatCheck.Violation> violations = new ArrayList<>();
        int questions = countQuestionMarks(text);
        int words = text.split("\\s+").length;

        if (questions > 1) {
            violations.add(FormatCheck.Violation.MULTIPLE_QUESTIONS);
        } else if (questions == 0 && !containsAcknowledgment(text)) {
            violations.add(FormatCheck.Violation.NO_QUESTION_OR_ACKNOWLEDGMENT);
        }
        if (words >= wordCeiling) {
            violations.add(FormatCheck.Violation.TOO_LONG);
        }
        if (LIST_LINE.matcher(text).find()) {
            violations.add(FormatCheck.Violation.LIST_FORMAT);
        }
        if (STEP_SEQUENCE.matcher(text).find()) {
            violations.add(FormatCheck.Violation.STEP_SEQUENCE);
        }
        return new FormatCheck(violations, words, questions);
    }

    public int wordCeiling() {
        return wordCeiling;
    }

    static boolean containsAcknowledgment(String text) {
        String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        for (String phrase : ACKNOWLEDGMENT_PHRASES) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static int countQuestionMarks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '?') {
                count++;
            }
        }
        return count;
    }
}
