package br.edu.ifba.journal.pipeline;

/**
 * States of one read-path invocation. {@code DONE} and {@code FAILED} are terminal.
 */
public enum TurnState {
    IDLE,
    RETRIEVING,
    ROUTING,
    GENERATING,
    VALIDATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
