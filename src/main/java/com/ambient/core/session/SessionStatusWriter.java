package com.ambient.core.session;

import com.ambient.core.cluster.ConflictException;
import com.ambient.core.cluster.NotFoundException;
import com.ambient.core.cluster.ResourceStore;
import com.ambient.core.metrics.AmbientMetrics;
import com.ambient.core.model.Session;
import com.ambient.core.model.SessionPhase;
import com.ambient.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The single write path for session status. Every write re-reads the object, checks the phase
 * edge against {@link SessionPhase#canTransitionTo}, merges the typed fields and replaces the
 * status sub-resource. The store's optimistic concurrency is the only ordering guard: a stale
 * write is re-read and retried.
 * <p>
 * A session deleted while being written is not an error; the write returns empty.
 */
@Service
public class SessionStatusWriter {

    private static final Logger log = LoggerFactory.getLogger(SessionStatusWriter.class);

    static final int CONFLICT_ATTEMPTS = 3;

    private final AmbientMetrics metrics;

    public SessionStatusWriter(AmbientMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Moves the session to {@code target}.
     *
     * @param decorate extra fields to set on the new status (timestamps, job name)
     * @return the updated session, or empty if the session no longer exists
     * @throws SessionStateException if the current phase does not allow the edge
     */
    public Optional<Session> transition(ResourceStore<Session> store, String namespace, String name,
                                        SessionPhase target, String message,
                                        UnaryOperator<SessionStatus> decorate) {
        return write(store, namespace, name, current -> {
            SessionPhase from = effectivePhase(current);
            if (!from.canTransitionTo(target)) {
                throw new SessionStateException("Cannot move session %s from %s to %s"
                        .formatted(name, from, target), from, target);
            }
            return decorate.apply(base(current).merge(SessionStatus.phase(target, message)));
        }, target);
    }

    /**
     * Sets {@code Pending} on a session whose status was never written. Sessions that already
     * have a phase are returned unchanged.
     */
    public Optional<Session> initialize(ResourceStore<Session> store, String namespace, String name) {
        Optional<Session> current = store.find(namespace, name);
        if (current.isEmpty() || current.get().phase() != null) {
            return current;
        }
        return write(store, namespace, name, session -> session.phase() != null
                ? session.status()
                : base(session).merge(SessionStatus.phase(SessionPhase.PENDING, null)), SessionPhase.PENDING);
    }

    /**
     * Merges a result summary reported by the workload. A phase in the report is validated like
     * any other transition; reporting the current phase again is accepted.
     */
    public Optional<Session> report(ResourceStore<Session> store, String namespace, String name,
                                    SessionStatus update) {
        return write(store, namespace, name, current -> {
            SessionPhase from = effectivePhase(current);
            SessionPhase requested = update.phase();
            if (requested != null && requested != from && !from.canTransitionTo(requested)) {
                throw new SessionStateException("Cannot move session %s from %s to %s"
                        .formatted(name, from, requested), from, requested);
            }
            return base(current).merge(update);
        }, update.phase());
    }

    private Optional<Session> write(ResourceStore<Session> store, String namespace, String name,
                                    Function<Session, SessionStatus> change,
                                    SessionPhase recordedPhase) {
        for (int attempt = 1; ; attempt++) {
            Optional<Session> current = store.find(namespace, name);
            if (current.isEmpty()) {
                log.debug("Session {}/{} disappeared before its status could be written", namespace, name);
                return Optional.empty();
            }
            SessionStatus next = change.apply(current.get());
            try {
                Session updated = store.replaceStatus(current.get().withStatus(next));
                if (recordedPhase != null && recordedPhase != current.get().phase()) {
                    metrics.recordPhaseTransition(recordedPhase.wireName());
                }
                return Optional.ofNullable(updated);
            } catch (NotFoundException e) {
                log.debug("Session {}/{} deleted during status write", namespace, name);
                return Optional.empty();
            } catch (ConflictException e) {
                if (attempt >= CONFLICT_ATTEMPTS) {
                    throw e;
                }
                log.debug("Status write conflict on {}/{} (attempt {}), re-reading", namespace, name, attempt);
            }
        }
    }

    /** A session with no status yet is treated as {@code Pending}. */
    static SessionPhase effectivePhase(Session session) {
        return session.phase() == null ? SessionPhase.PENDING : session.phase();
    }

    private static SessionStatus base(Session session) {
        return session.status() != null ? session.status() : SessionStatus.phase(null, null);
    }
}
