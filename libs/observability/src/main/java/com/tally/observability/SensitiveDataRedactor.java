package com.tally.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Redacts sensitive fields from structured values before they are logged or written to the audit
 * ledger.
 *
 * <p>Field names are normalized (lower-cased, {@code _} and {@code -} removed) and compared by
 * substring against the patterns, so {@code api_key}, {@code apiKey} and {@code X-Api-Key} all
 * match "apikey". Bare "token" is not a default pattern because usage fields such as
 * {@code tokensPerMonth} must stay readable; {@code accessToken} and {@code refreshToken} are.
 * Nested maps and lists are redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS =
            Set.of(
                    "password",
                    "secret",
                    "authorization",
                    "apikey",
                    "credential",
                    "accesstoken",
                    "refreshtoken",
                    "bearer",
                    "cardnumber",
                    "cvc");

    private final Set<String> sensitivePatterns;

    /** Creates a redactor with the default sensitive field patterns. */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (normalized like field names).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        this.sensitivePatterns =
                patterns.stream()
                        .map(SensitiveDataRedactor::normalize)
                        .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Returns a new map with sensitive field values replaced by {@value #REDACTED}. Null input
     * returns an empty map.
     *
     * @param data keys are field names, values are arbitrary (maps and lists are walked)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            result.put(key, isSensitive(key) ? REDACTED : redactValue(entry.getValue()));
        }
        return result;
    }

    /**
     * Checks whether a field name matches any sensitive pattern.
     *
     * @param fieldName the field name to check
     * @return true if the normalized field name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String normalized = normalize(fieldName);
        for (String pattern : sensitivePatterns) {
            if (normalized.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    /** Returns the set of normalized sensitive patterns this redactor uses. */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), v));
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(this::redactValue).toList();
        }
        return value;
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }
}
