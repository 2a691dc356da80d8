package com.polyagent.session;

import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.orchestration.paradigm.Paradigm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * In-memory owner of all session state. Every transition runs inside {@link ConcurrentMap#compute}
 * for its own key, so two callers on one id are serialized while unrelated ids never contend.
 */
@Service
@Slf4j
public class SessionManager {

    private final ConcurrentMap<String, CollaborationSession> sessions = new ConcurrentHashMap<>();
    private final int maxRetained;

    public SessionManager(PolyAgentProperties properties) {
        this.maxRetained = properties.getSessions().getMaxRetained();
    }

    /**
     * Creates an idle session so clients can subscribe to its stream before the run starts.
     */
    public CollaborationSession open(String sessionId, @Nullable Paradigm paradigm, List<String> agents) {
        return sessions.compute(sessionId, (id, existing) -> {
            if (existing != null) {
                rejectUnlessIdle(existing);
            }
            return CollaborationSession.idle(id, paradigm, agents);
        });
    }

    /**
     * Moves an absent or idle session to running. Exactly one concurrent caller wins.
     *
     * @throws CollaborationException {@code SESSION_BUSY} while running, {@code SESSION_CLOSED} once terminal
     */
    public SessionGuard begin(String sessionId, Paradigm paradigm, String task, List<String> agents) {
        String owner = UUID.randomUUID().toString();
        sessions.compute(sessionId, (id, existing) -> {
            CollaborationSession base = existing;
            if (base == null) {
                base = CollaborationSession.idle(id, paradigm, agents);
            } else {
                rejectUnlessIdle(base);
            }
            return base.running(paradigm, task, agents, owner);
        });
        log.info("Session {} is running ({}).", sessionId, paradigm.id());
        return new SessionGuard(sessionId, owner);
    }

    /**
     * @return {@code true} if this call ended the run, {@code false} if it had already ended
     */
    public boolean complete(SessionGuard guard, CollaborationResult result) {
        boolean transitioned = finish(guard, session -> session.completed(result));
        if (transitioned) {
            log.info("Session {} completed.", guard.sessionId());
            evictIfNeeded();
        }
        return transitioned;
    }

    /**
     * @return {@code true} if this call ended the run, {@code false} if it had already ended
     */
    public boolean fail(SessionGuard guard, CollaborationErrorKind kind, String message) {
        boolean transitioned = finish(guard, session -> session.failed(kind, message));
        if (transitioned) {
            log.info("Session {} failed ({}): {}", guard.sessionId(), kind, message);
            evictIfNeeded();
        }
        return transitioned;
    }

    public CollaborationSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new CollaborationException(
                CollaborationErrorKind.SESSION_NOT_FOUND, sessionId, "Session not found: " + sessionId));
    }

    public Optional<CollaborationSession> find(String sessionId) {
        return Optional.ofNullable(sessionId != null ? sessions.get(sessionId) : null);
    }

    public List<CollaborationSession> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(CollaborationSession::createdAt))
                .toList();
    }

    /**
     * Forgets a session that is not running so its id can be used again.
     */
    public void reset(String sessionId) {
        AtomicBoolean removed = new AtomicBoolean();
        sessions.computeIfPresent(sessionId, (id, existing) -> {
            if (existing.state() == SessionState.RUNNING) {
                throw new CollaborationException(CollaborationErrorKind.SESSION_BUSY, id,
                        "Session " + id + " is running and cannot be reset.");
            }
            removed.set(true);
            return null;
        });
        if (!removed.get()) {
            throw new CollaborationException(CollaborationErrorKind.SESSION_NOT_FOUND, sessionId,
                    "Session not found: " + sessionId);
        }
        log.info("Session {} reset.", sessionId);
    }

    private boolean finish(SessionGuard guard, UnaryOperator<CollaborationSession> transition) {
        AtomicBoolean transitioned = new AtomicBoolean();
        sessions.computeIfPresent(guard.sessionId(), (id, existing) -> {
            if (existing.state() != SessionState.RUNNING || !guard.owner().equals(existing.owner())) {
                return existing;
            }
            transitioned.set(true);
            return transition.apply(existing);
        });
        return transitioned.get();
    }

    private void rejectUnlessIdle(CollaborationSession existing) {
        if (existing.state() == SessionState.RUNNING) {
            throw new CollaborationException(CollaborationErrorKind.SESSION_BUSY, existing.id(),
                    "Session " + existing.id() + " is already running.");
        }
        if (existing.state().isTerminal()) {
            throw new CollaborationException(CollaborationErrorKind.SESSION_CLOSED, existing.id(),
                    "Session " + existing.id() + " has already " + existing.state().name().toLowerCase(Locale.ROOT)
                            + "; reset it or use a new id.");
        }
    }

    private synchronized void evictIfNeeded() {
        List<CollaborationSession> terminal = sessions.values().stream()
                .filter(session -> session.state().isTerminal())
                .sorted(Comparator.comparing(CollaborationSession::endedAt))
                .toList();
        int excess = terminal.size() - maxRetained;
        for (int i = 0; i < excess; i++) {
            CollaborationSession oldest = terminal.get(i);
            if (sessions.remove(oldest.id(), oldest)) {
                log.warn("Evicted session {} (ended at {}) to stay within {} retained sessions.",
                        oldest.id(), oldest.endedAt(), maxRetained);
            }
        }
    }
}
