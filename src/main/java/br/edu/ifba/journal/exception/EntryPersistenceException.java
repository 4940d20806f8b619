package br.edu.ifba.journal.exception;

/**
 * Saving, reading or deleting the entry itself failed. Unlike enrichment failures this is surfaced
 * to the caller: losing the user's journal text is never acceptable.
 */
public class EntryPersistenceException extends RuntimeException {

    public EntryPersistenceException(final String message) {
        super(message);
    }

    public EntryPersistenceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
