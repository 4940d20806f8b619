package br.edu.ifba.journal.prompt;

import java.util.List;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;

/**
 * Result of checking a reply against the reply format contract.
 *
 * @param violations everything wrong with the reply; empty when it conforms
 * @param wordCount words counted in the reply
 * @param questionCount question marks counted in the reply
 */
public record FormatCheck(@NotNull List<Violation> violations, int wordCount, int questionCount) {

    public enum Violation {
        EMPTY("reply is empty"),
        NO_QUESTION_OR_ACKNOWLEDGMENT("reply neither asks one question nor acknowledges the user"),
        MULTIPLE_QUESTIONS("reply asks more than one question"),
        TOO_LONG("reply is too long"),
        LIST_FORMAT("reply contains a bulleted or numbered list"),
        STEP_SEQUENCE("reply gives multi-step instructions");

        private final String description;

        Violation(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public FormatCheck {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Human-readable list of the violations, used in corrective instructions and logs.
     */
    @NotNull
    public String describe() {
        return violations.stream().map(Violation::description).collect(Collectors.joining("; "));
    }
}
