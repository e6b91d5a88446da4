package com.warden.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces credential-bearing values in structured log data with {@value #REDACTED}.
 *
 * <p>Field names are matched case-insensitively by substring, so {@code X-Session-Token} and
 * {@code access_token} are both caught by {@code token}.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS =
            Set.of("password", "token", "secret", "authorization", "apikey", "api_key", "cookie", "credential");

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced. Null input yields an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
