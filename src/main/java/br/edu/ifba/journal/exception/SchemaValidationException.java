package br.edu.ifba.journal.exception;

import java.util.List;

/**
 * Generated output did not match the required structure.
 */
public class SchemaValidationException extends RuntimeException {

    private final List<String> problems;

    public SchemaValidationException(final String message, final List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public SchemaValidationException(final String message, final Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
