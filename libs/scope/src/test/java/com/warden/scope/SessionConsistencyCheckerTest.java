package com.warden.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionConsistencyChecker")
class SessionConsistencyCheckerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ScopeVersionManager versions;

    @InjectMocks
    private SessionConsistencyChecker checker;

    private static SessionSnapshot session(long version) {
        return new SessionSnapshot("s1", "tok", "u1", "t1", List.of("user"), Set.of("app:read"),
                version, NOW, NOW.plusSeconds(1800), NOW, true);
    }

    @Nested
    @DisplayName("version comparison")
    class VersionComparison {

        @Test
        @DisplayName("behind the current version is STALE with both versions")
        void stale() {
            when(versions.getVersion("u1", "t1")).thenReturn(3L);

            ConsistencyCheck result = checker.check(2L, "u1", "t1");

            assertThat(result.verdict()).isEqualTo(ConsistencyVerdict.STALE);
            assertThat(result.sessionVersion()).isEqualTo(2L);
            assertThat(result.currentVersion()).isEqualTo(3L);
        }

        @Test
        @DisplayName("equal to the current version is VALID")
        void valid() {
            when(versions.getVersion("u1", "t1")).thenReturn(3L);

            assertThat(checker.check(3L, "u1", "t1").verdict()).isEqualTo(ConsistencyVerdict.VALID);
        }

        @Test
        @DisplayName("pure comparison never records a check")
        void noWrites() {
            when(versions.getVersion("u1", "t1")).thenReturn(1L);

            checker.check(1L, "u1", "t1");

            verify(versions, never()).markScopeChecked(anyString());
        }
    }

    @Nested
    @DisplayName("token verdicts")
    class TokenVerdicts {

        @Test
        @DisplayName("rejected token is INVALID without a version lookup")
        void invalid() {
            ConsistencyCheck result = checker.check(TokenVerdict.rejected(TokenVerdict.SESSION_EXPIRED));

            assertThat(result.verdict()).isEqualTo(ConsistencyVerdict.INVALID);
            assertThat(result.reason()).isEqualTo("session_expired");
            verify(versions, never()).getVersion(anyString(), anyString());
        }

        @Test
        @DisplayName("VALID session records its check time")
        void validRecordsCheck() {
            when(versions.getVersion("u1", "t1")).thenReturn(2L);

            ConsistencyCheck result = checker.check(TokenVerdict.authentic(session(2L)));

            assertThat(result.isValid()).isTrue();
            verify(versions).markScopeChecked("s1");
        }

        @Test
        @DisplayName("STALE session is not marked checked")
        void staleNotRecorded() {
            when(versions.getVersion("u1", "t1")).thenReturn(4L);

            ConsistencyCheck result = checker.check(TokenVerdict.authentic(session(2L)));

            assertThat(result.verdict()).isEqualTo(ConsistencyVerdict.STALE);
            verify(versions, never()).markScopeChecked(anyString());
        }
    }
}
