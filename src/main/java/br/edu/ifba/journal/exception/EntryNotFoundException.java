package br.edu.ifba.journal.exception;

import java.util.UUID;

public class EntryNotFoundException extends RuntimeException {

    public EntryNotFoundException(final UUID entryId) {
        super("Entry not found with id: " + entryId);
    }
}
