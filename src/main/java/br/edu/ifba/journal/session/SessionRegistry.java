package br.edu.ifba.journal.session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.journal.core.Turn;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

/**
 * In-memory transcripts of the sessions in progress, keyed by (owner, session).
 *
 * <p>Turns are appended by the read-path and consumed by the write-path. Sessions are lost on
 * restart; only saved entries are durable.</p>
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Copy of the session transcript, oldest first. Empty for an unknown session.
     */
    @NotNull
    public List<Turn> transcript(@NotNull String ownerId, @NotNull String sessionId) {
        Session session = sessions.get(key(ownerId, sessionId));
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            return List.copyOf(session.getTurns());
        }
    }

    public void append(@NotNull String ownerId, @NotNull String sessionId, @NotNull Turn... turns) {
        Session session = sessions.computeIfAbsent(key(ownerId, sessionId),
            k -> new Session(ownerId, sessionId, Instant.now()));
        synchronized (session) {
            session.getTurns().addAll(List.of(turns));
            session.setLastActivity(Instant.now());
        }
    }

    /**
     * Removes the first {@code savedTurns} turns of the session, i.e. the ones that were just
     * saved. Turns appended after the snapshot was taken are kept.
     */
    public void clear(@NotNull String ownerId, @NotNull String sessionId, int savedTurns) {
        sessions.computeIfPresent(key(ownerId, sessionId), (k, session) -> {
            synchronized (session) {
                List<Turn> turns = session.getTurns();
                turns.subList(0, Math.min(savedTurns, turns.size())).clear();
                return turns.isEmpty() ? null : session;
            }
        });
        logger.debug("Cleared {} saved turns of session {} for owner {}", savedTurns, sessionId, ownerId);
    }

    public int activeSessions() {
        return sessions.size();
    }

    private static String key(String ownerId, String sessionId) {
        return ownerId + "|" + sessionId;
    }

    @Getter
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    static final class Session {
        private final String ownerId;
        private final String sessionId;
        private final Instant startedAt;
        private final List<Turn> turns = new ArrayList<>();

        @Setter
        private Instant lastActivity;
    }
}
