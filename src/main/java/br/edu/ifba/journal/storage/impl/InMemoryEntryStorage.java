package br.edu.ifba.journal.storage.impl;

import br.edu.ifba.journal.core.Entry;
import br.edu.ifba.journal.storage.EntryStorage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEntryStorage implements EntryStorage {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntryStorage.class);

    private final ConcurrentHashMap<UUID, Entry> entries = new ConcurrentHashMap<>();

    private volatile boolean initialized = false;

    @Override
    public void initialize() {
        if (!initialized) {
            initialized = true;
            logger.info("InMemoryEntryStorage initialized");
        }
    }

    @Override
    public void save(@NotNull Entry entry) {
        ensureInitialized();
        entries.merge(entry.id(), entry, (existing, incoming) -> {
            if (!existing.isOwnedBy(incoming.ownerId())) {
                throw new IllegalArgumentException("Entry " + entry.id() + " belongs to another owner");
            }
            return incoming;
        });
        logger.debug("Saved entry {} for owner {}", entry.id(), entry.ownerId());
    }

    @Override
    @NotNull
    public Optional<Entry> findById(@NotNull String ownerId, @NotNull UUID entryId) {
        ensureInitialized();
        return Optional.ofNullable(entries.get(entryId)).filter(entry -> entry.isOwnedBy(ownerId));
    }

    @Override
    @NotNull
    public List<Entry> findByOwner(@NotNull String ownerId, int limit) {
        ensureInitialized();
        return entries.values().stream()
            .filter(entry -> entry.isOwnedBy(ownerId))
            .sorted(Comparator.comparing(Entry::createdAt).reversed().thenComparing(Entry::id, Comparator.reverseOrder()))
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public boolean delete(@NotNull String ownerId, @NotNull UUID entryId) {
        ensureInitialized();
        Entry existing = entries.get(entryId);
        if (existing == null || !existing.isOwnedBy(ownerId)) {
            return false;
        }
        return entries.remove(entryId, existing);
    }

    @Override
    public void close() {
        entries.clear();
        initialized = false;
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
