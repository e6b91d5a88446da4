package com.warden.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeVersionManager")
class ScopeVersionManagerTest {

    private ScopeFixture fx;
    private ScopeVersionManager versions;

    @BeforeEach
    void setUp() {
        fx = new ScopeFixture();
        versions = fx.versions;
    }

    @Nested
    @DisplayName("getVersion()")
    class GetVersion {

        @Test
        @DisplayName("defaults to 1 for a scope never written")
        void lazyDefault() {
            assertThat(versions.getVersion("nobody", "t1")).isEqualTo(1L);
            assertThat(versions.getVersion("nobody", null)).isEqualTo(1L);
        }

        @Test
        @DisplayName("absent and blank tenant both address the global scope")
        void globalAliases() {
            versions.update("u1", null, List.of("app:read"), List.of("viewer"));
            assertThat(versions.getVersion("u1", "global")).isEqualTo(2L);
            assertThat(versions.getVersion("u1", " ")).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailures {

        private final ScopeStateRepository failing = mock(ScopeStateRepository.class);
        private final ScopeVersionManager broken =
                new ScopeVersionManager(failing, new InMemorySessionRepository(), new ScopeFixture().clock,
                        ScopeFixture.MAX_CHECK_AGE);

        @Test
        @DisplayName("a failed read surfaces as ScopeStoreUnavailableException with the cause")
        void readFailure() {
            IllegalStateException cause = new IllegalStateException("connection refused");
            when(failing.find(any())).thenThrow(cause);

            assertThatThrownBy(() -> broken.getVersion("u1", "t1"))
                    .isInstanceOf(ScopeStoreUnavailableException.class)
                    .hasMessageContaining("u1@t1")
                    .hasCause(cause);
        }

        @Test
        @DisplayName("a failed write surfaces as ScopeStoreUnavailableException and no version is recorded")
        void writeFailure() {
            when(failing.find(any())).thenReturn(Optional.empty());
            doThrow(new IllegalStateException("disk full")).when(failing).saveWithEvent(any(), any());

            assertThatThrownBy(() -> broken.update("u1", "t1", List.of("app:read"), List.of("viewer")))
                    .isInstanceOf(ScopeStoreUnavailableException.class)
                    .hasMessageContaining("write");
            assertThat(broken.getVersion("u1", "t1")).isEqualTo(1L);
        }

        @Test
        @DisplayName("an adapter's own ScopeStoreUnavailableException passes through unchanged")
        void passThrough() {
            ScopeStoreUnavailableException own = new ScopeStoreUnavailableException("down");
            when(failing.pendingEvents(5)).thenThrow(own);

            assertThatThrownBy(() -> broken.pendingChangeEvents(5)).isSameAs(own);
        }
    }

    @Nested
    @DisplayName("update()")
    class Update {

        @Test
        @DisplayName("bumps by exactly one per distinct change")
        void monotonic() {
            long version = 1;
            for (int i = 0; i < 5; i++) {
                long next = versions.update("u1", "t1", List.of("cap:" + i), List.of("user"));
                assertThat(next).isEqualTo(version + 1);
                version = next;
            }
            assertThat(versions.getVersion("u1", "t1")).isEqualTo(6L);
        }

        @Test
        @DisplayName("same content in any order is a no-op without an event")
        void idempotent() {
            long first = versions.update("u1", "t1", List.of("a:x", "b:y"), List.of("user", "viewer"));
            long second = versions.update("u1", "t1", List.of("b:y", "a:x", "a:x"), List.of("viewer", "user"));

            assertThat(second).isEqualTo(first).isEqualTo(2L);
            assertThat(versions.history("u1", "t1")).hasSize(1);
        }

        @Test
        @DisplayName("empty content on a fresh scope matches the initial state")
        void emptyOnFreshScope() {
            assertThat(versions.update("u1", "t1", List.of(), List.of())).isEqualTo(1L);
            assertThat(versions.pendingChangeEvents()).isEmpty();
        }

        @Test
        @DisplayName("event carries symmetric differences and classification")
        void eventContent() {
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            versions.update("u1", "t1", List.of("app:read", "app:write"), List.of("viewer", "user"));
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            versions.update("u1", "t1", List.of("reports:view"), List.of("viewer"));

            List<ScopeChangeEvent> history = versions.history("u1", "t1");
            assertThat(history).extracting(ScopeChangeEvent::newVersion).containsExactly(2L, 3L, 4L, 5L);
            assertThat(history).extracting(ScopeChangeEvent::changeType).containsExactly(
                    ChangeType.ADDED, ChangeType.ADDED, ChangeType.REMOVED, ChangeType.MODIFIED);
            assertThat(history.get(1).changedCapabilities()).containsExactly("app:write");
            assertThat(history.get(1).changedRoles()).containsExactly("user");
            assertThat(history.get(3).changedCapabilities()).containsExactly("app:read", "reports:view");
            assertThat(history.get(3).changedRoles()).isEmpty();
        }

        @Test
        @DisplayName("tenant scopes of one user are independent")
        void tenantIsolation() {
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            versions.update("u1", "t1", List.of("app:write"), List.of("user"));

            assertThat(versions.getVersion("u1", "t1")).isEqualTo(3L);
            assertThat(versions.getVersion("u1", "t2")).isEqualTo(1L);
            assertThat(versions.getVersion("u1", null)).isEqualTo(1L);
        }

        @Test
        @DisplayName("concurrent updates of different users never disturb each other")
        void userIsolationUnderConcurrency() throws Exception {
            int users = 8;
            int updatesPerUser = 50;
            ExecutorService pool = Executors.newFixedThreadPool(users);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int u = 0; u < users; u++) {
                    String user = "user-" + u;
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < updatesPerUser; i++) {
                            versions.update(user, "t1", List.of("cap:" + i), List.of("user"));
                        }
                        return null;
                    }));
                }
                versions.update("bystander", "t1", List.of("app:read"), List.of("viewer"));
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            for (int u = 0; u < users; u++) {
                assertThat(versions.getVersion("user-" + u, "t1")).isEqualTo(1L + updatesPerUser);
            }
            assertThat(versions.getVersion("bystander", "t1")).isEqualTo(2L);
        }

        @Test
        @DisplayName("concurrent updates of one scope never lose a bump")
        void noLostUpdates() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Long> results = Collections.synchronizedList(new ArrayList<>());
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < threads; t++) {
                    String capability = "cap:thread" + t;
                    futures.add(pool.submit(() -> {
                        start.await();
                        results.add(versions.update("u1", "t1", List.of(capability), List.of("user")));
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(results).doesNotHaveDuplicates().hasSize(threads);
            assertThat(versions.getVersion("u1", "t1")).isEqualTo(1L + threads);
            assertThat(versions.history("u1", "t1")).extracting(ScopeChangeEvent::newVersion)
                    .isSorted().hasSize(threads);
        }
    }

    @Nested
    @DisplayName("invalidateSessions()")
    class InvalidateSessions {

        @Test
        @DisplayName("deactivates exactly the sessions below the minimum version")
        void selective() {
            List<SessionSnapshot> sessions = new ArrayList<>();
            for (long v = 1; v <= 5; v++) {
                sessions.add(fx.sessionAt("u1", "t1", v));
            }

            int invalidated = versions.invalidateSessions("u1", "t1", 4);

            assertThat(invalidated).isEqualTo(3);
            assertThat(fx.sessionStore.findActive(ScopeKey.of("u1", "t1")))
                    .extracting(SessionSnapshot::scopeVersion)
                    .containsExactlyInAnyOrder(4L, 5L);
        }

        @Test
        @DisplayName("leaves other tenants and users alone and counts only new deactivations")
        void scoped() {
            fx.sessionAt("u1", "t1", 1);
            fx.sessionAt("u1", "t2", 1);
            fx.sessionAt("u2", "t1", 1);

            assertThat(versions.invalidateSessions("u1", "t1", 5)).isEqualTo(1);
            assertThat(versions.invalidateSessions("u1", "t1", 5)).isZero();
            assertThat(fx.sessionStore.findAllActive()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("sessionsNeedingUpdate()")
    class SessionsNeedingUpdate {

        @Test
        @DisplayName("reports sessions behind their scope version")
        void behind() {
            SessionSnapshot old = fx.sessionAt("u1", "t1", 1);
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            fx.sessionAt("u1", "t1", 2);

            assertThat(versions.sessionsNeedingUpdate())
                    .singleElement()
                    .satisfies(ref -> {
                        assertThat(ref.sessionId()).isEqualTo(old.sessionId());
                        assertThat(ref.reason()).isEqualTo(SessionRef.Reason.VERSION_BEHIND);
                        assertThat(ref.currentVersion()).isEqualTo(2L);
                    });
        }

        @Test
        @DisplayName("reports current sessions whose last check is older than the maximum age")
        void drift() {
            SessionSnapshot session = fx.sessionAt("u1", "t1", 1);
            assertThat(versions.sessionsNeedingUpdate()).isEmpty();

            fx.clock.advance(ScopeFixture.MAX_CHECK_AGE.plus(Duration.ofSeconds(1)));

            assertThat(versions.sessionsNeedingUpdate())
                    .extracting(SessionRef::sessionId, SessionRef::reason)
                    .containsExactly(tuple(session.sessionId(), SessionRef.Reason.CHECK_EXPIRED));

            versions.markScopeChecked(session.sessionId());
            assertThat(versions.sessionsNeedingUpdate()).isEmpty();
        }
    }

    @Nested
    @DisplayName("pending change events")
    class PendingEvents {

        @Test
        @DisplayName("are returned in append order until marked processed")
        void drain() {
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            versions.update("u2", "t1", List.of("app:read"), List.of("viewer"));
            versions.update("u1", "t1", Set.of("app:write"), Set.of("user"));

            List<ScopeChangeEvent> pending = versions.pendingChangeEvents();
            assertThat(pending).extracting(ScopeChangeEvent::userId).containsExactly("u1", "u2", "u1");
            assertThat(versions.pendingChangeEvents(2)).hasSize(2);

            versions.markProcessed(List.of(pending.get(0).eventId(), pending.get(1).eventId()));

            assertThat(versions.pendingChangeEvents()).singleElement()
                    .extracting(ScopeChangeEvent::newVersion).isEqualTo(3L);
        }

        @Test
        @DisplayName("convert to the flat scope_change payload")
        void notification() {
            versions.update("u1", "t1", List.of("app:read"), List.of("viewer"));
            var notification = versions.pendingChangeEvents().get(0).toNotification();

            assertThat(notification.type()).isEqualTo("scope_change");
            assertThat(notification.userId()).isEqualTo("u1");
            assertThat(notification.tenantId()).isEqualTo("t1");
            assertThat(notification.oldVersion()).isEqualTo(1L);
            assertThat(notification.newVersion()).isEqualTo(2L);
            assertThat(notification.changeType()).isEqualTo("added");
            assertThat(notification.changedCapabilities()).containsExactly("app:read");
            assertThat(notification.changedRoles()).containsExactly("viewer");
        }
    }
}
