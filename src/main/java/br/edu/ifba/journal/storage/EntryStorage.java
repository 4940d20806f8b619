package br.edu.ifba.journal.storage;

import br.edu.ifba.journal.core.Entry;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of journal entries. Synchronous: a save that returns has been durably stored.
 *
 * <p>Failures surface as {@link br.edu.ifba.journal.exception.EntryPersistenceException}.</p>
 */
public interface EntryStorage extends AutoCloseable {

    void initialize();

    /**
     * Saves an entry. Saving an id that already exists merges into the stored row.
     */
    void save(@NotNull Entry entry);

    @NotNull
    Optional<Entry> findById(@NotNull String ownerId, @NotNull UUID entryId);

    /**
     * Entries of an owner, newest first.
     */
    @NotNull
    List<Entry> findByOwner(@NotNull String ownerId, int limit);

    /**
     * @return true if an entry was deleted
     */
    boolean delete(@NotNull String ownerId, @NotNull UUID entryId);

    @Override
    void close();
}
