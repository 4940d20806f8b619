package br.edu.ifba.journal.exception;

/**
 * An external capability (embedding, graph, generation, extraction) was unreachable or timed out.
 * Always recovered locally by a fallback or an empty result.
 */
public class DependencyUnavailableException extends RuntimeException {

    private final String dependency;

    public DependencyUnavailableException(final String dependency, final String message) {
        super(message);
        this.dependency = dependency;
    }

    public DependencyUnavailableException(final String dependency, final String message, final Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
