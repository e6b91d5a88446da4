package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("anonymous context only sets the correlation ID")
        void anonymous() {
            CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }

        @Test
        @DisplayName("principal enrichment populates user, tenant, session and scope version")
        void principal() {
            var ctx = CorrelationContext.anonymous("corr-1").withPrincipal("u1", "t1", "s1", 7);

            CorrelationContextHolder.set(ctx);

            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("u1");
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo("t1");
            assertThat(MDC.get(CorrelationContext.MDC_SESSION_ID)).isEqualTo("s1");
            assertThat(MDC.get(CorrelationContext.MDC_SCOPE_VERSION)).isEqualTo("7");
        }

        @Test
        @DisplayName("clear() removes every key")
        void clearRemovesKeys() {
            CorrelationContextHolder.set(
                    CorrelationContext.anonymous("c").withPrincipal("u1", "t1", "s1", 1));

            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_SCOPE_VERSION)).isNull();
        }
    }

    @Test
    @DisplayName("runWithContext() restores the previous context")
    void runWithContextRestores() {
        CorrelationContextHolder.set(CorrelationContext.anonymous("outer"));

        CorrelationContextHolder.runWithContext(
                CorrelationContext.anonymous("inner"),
                () -> assertThat(CorrelationContextHolder.correlationId()).contains("inner"));

        assertThat(CorrelationContextHolder.correlationId()).contains("outer");
    }

    @Test
    @DisplayName("blank correlation IDs are rejected")
    void blankRejected() {
        assertThatThrownBy(() -> CorrelationContext.anonymous(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
