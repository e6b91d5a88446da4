package com.warden.scope;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-scope version counter and the change-event log.
 *
 * <p>{@link #update} is serialized per {@link ScopeKey} with one lock per key. Updates to
 * different keys take different locks and never wait on each other. Reads take no lock.
 * {@link #withKeyLock} lets a caller run a membership write and the matching update under the
 * same lock, so the stored content always follows the order of the writes.
 *
 * <p>A committed bump is never rolled back: it records that the scope content changed.
 *
 * <p>Any failure of the {@link ScopeStateRepository} surfaces as a
 * {@link ScopeStoreUnavailableException}, which the boundary maps to a fail-closed answer.
 */
public class ScopeVersionManager {

    private static final Logger log = LoggerFactory.getLogger(ScopeVersionManager.class);

    private final ScopeStateRepository states;
    private final SessionRepository sessions;
    private final Clock clock;
    private final Duration maxCheckAge;
    private final Map<ScopeKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * @param maxCheckAge age after which a session's last confirmed scope check is considered
     *     stale by {@link #sessionsNeedingUpdate()}
     */
    public ScopeVersionManager(
            ScopeStateRepository states, SessionRepository sessions, Clock clock, Duration maxCheckAge) {
        this.states = states;
        this.sessions = sessions;
        this.clock = clock;
        this.maxCheckAge = maxCheckAge;
    }

    /** Stored version, or {@value ScopeState#INITIAL_VERSION} for a scope never written. */
    public long getVersion(String userId, String tenantId) {
        return currentState(ScopeKey.of(userId, tenantId)).version();
    }

    /** Stored state of {@code key}, or the initial empty state. */
    public ScopeState currentState(ScopeKey key) {
        return store("read", key, () -> states.find(key)).orElseGet(() -> ScopeState.initial(key));
    }

    /**
     * Replaces the scope content and bumps the version by one if the content differs.
     *
     * <p>Capabilities and roles are compared as sets; identical content returns the current
     * version with no write and no event.
     *
     * @return the version after the call
     */
    public long update(
            String userId, String tenantId, Collection<String> capabilities, Collection<String> roles) {
        ScopeKey key = ScopeKey.of(userId, tenantId);
        Set<String> newCapabilities = new TreeSet<>(capabilities);
        Set<String> newRoles = new TreeSet<>(roles);

        return withKeyLock(key, () -> {
            ScopeState current = currentState(key);
            if (current.sameContent(newCapabilities, newRoles)) {
                log.debug("Scope {} unchanged at version {}", key, current.version());
                return current.version();
            }

            Instant now = clock.instant();
            long newVersion = current.version() + 1;
            ScopeChangeEvent event = new ScopeChangeEvent(
                    UUID.randomUUID().toString(),
                    key,
                    current.version(),
                    newVersion,
                    symmetricDifference(current.capabilities(), newCapabilities),
                    symmetricDifference(current.roles(), newRoles),
                    ChangeType.classify(
                            current.capabilities(), newCapabilities, current.roles(), newRoles),
                    now);
            ScopeState next = new ScopeState(key, newVersion, newCapabilities, newRoles, now);
            store("write", key, () -> {
                states.saveWithEvent(next, event);
                return null;
            });

            log.info("Scope {} version {} -> {} ({}, capabilities {}, roles {})",
                    key, current.version(), newVersion, event.changeType().value(),
                    event.changedCapabilities(), event.changedRoles());
            return newVersion;
        });
    }

    /**
     * Runs {@code action} holding the update lock of {@code key}. The lock is reentrant, so the
     * action may call {@link #update} for the same key.
     */
    public <T> T withKeyLock(ScopeKey key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deactivates every active session of the scope whose captured version is below
     * {@code minVersion}. Sessions at or above it are untouched.
     *
     * @return number of sessions this call deactivated
     */
    public int invalidateSessions(String userId, String tenantId, long minVersion) {
        ScopeKey key = ScopeKey.of(userId, tenantId);
        int invalidated = 0;
        for (SessionSnapshot session : sessions.findActive(key)) {
            if (session.scopeVersion() < minVersion && sessions.deactivate(session.sessionId())) {
                invalidated++;
            }
        }
        if (invalidated > 0) {
            log.info("Invalidated {} sessions of scope {} below version {}", invalidated, key, minVersion);
        }
        return invalidated;
    }

    /**
     * Active sessions that are behind their scope's current version, or whose last confirmed check
     * is older than the configured maximum age.
     */
    public List<SessionRef> sessionsNeedingUpdate() {
        Instant cutoff = clock.instant().minus(maxCheckAge);
        List<SessionRef> result = new ArrayList<>();
        for (SessionSnapshot session : sessions.findAllActive()) {
            long current = currentState(session.key()).version();
            if (session.scopeVersion() < current) {
                result.add(new SessionRef(session.sessionId(), session.key(),
                        session.scopeVersion(), current, SessionRef.Reason.VERSION_BEHIND));
            } else if (session.lastScopeCheckAt() == null
                    || session.lastScopeCheckAt().isBefore(cutoff)) {
                result.add(new SessionRef(session.sessionId(), session.key(),
                        session.scopeVersion(), current, SessionRef.Reason.CHECK_EXPIRED));
            }
        }
        return result;
    }

    /** Records that a session's version was confirmed current now. */
    public boolean markScopeChecked(String sessionId) {
        return sessions.recordScopeCheck(sessionId, clock.instant());
    }

    /** All change events not yet marked processed, oldest first. */
    public List<ScopeChangeEvent> pendingChangeEvents() {
        return pendingChangeEvents(Integer.MAX_VALUE);
    }

    /** At most {@code limit} unprocessed change events, oldest first. */
    public List<ScopeChangeEvent> pendingChangeEvents(int limit) {
        return store("read pending events", null, () -> states.pendingEvents(limit));
    }

    /** Marks the given events as consumed. */
    public void markProcessed(Collection<String> eventIds) {
        store("mark processed", null, () -> {
            states.markProcessed(eventIds);
            return null;
        });
    }

    /** Every change event of the scope, processed or not, in version order. */
    public List<ScopeChangeEvent> history(String userId, String tenantId) {
        ScopeKey key = ScopeKey.of(userId, tenantId);
        return store("read history", key, () -> states.history(key));
    }

    private static <T> T store(String operation, ScopeKey key, Supplier<T> call) {
        try {
            return call.get();
        } catch (ScopeStoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            String target = key == null ? "" : " for " + key;
            log.warn("Scope store {} failed{}: {}", operation, target, e.getMessage());
            throw new ScopeStoreUnavailableException("Scope store " + operation + " failed" + target, e);
        }
    }

    private static List<String> symmetricDifference(Set<String> before, Set<String> after) {
        Set<String> diff = new TreeSet<>();
        for (String value : before) {
            if (!after.contains(value)) {
                diff.add(value);
            }
        }
        for (String value : after) {
            if (!before.contains(value)) {
                diff.add(value);
            }
        }
        return new ArrayList<>(diff);
    }
}
