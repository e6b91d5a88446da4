package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Test
    @DisplayName("redacts authorization headers and session tokens")
    void redactsCredentials() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Authorization", "Bearer abc");
        data.put("session_token", "xyz");
        data.put("path", "/api/v1/roles");

        var redacted = redactor.redact(data);

        assertThat(redacted)
                .containsEntry("Authorization", SensitiveDataRedactor.REDACTED)
                .containsEntry("session_token", SensitiveDataRedactor.REDACTED)
                .containsEntry("path", "/api/v1/roles");
    }

    @Test
    @DisplayName("null or empty input yields an empty map")
    void nullInput() {
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.redact(Map.of())).isEmpty();
    }

    @Test
    @DisplayName("custom patterns replace the defaults")
    void customPatterns() {
        var custom = new SensitiveDataRedactor(java.util.Set.of("capabilities"));

        assertThat(custom.isSensitive("user_capabilities")).isTrue();
        assertThat(custom.isSensitive("token")).isFalse();
    }
}
