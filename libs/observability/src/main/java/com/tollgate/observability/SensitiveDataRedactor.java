package com.tollgate.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-bearing entries before request metadata reaches a log line.
 * <p>
 * A key is sensitive when it contains any of the configured fragments, compared
 * case-insensitively. The defaults cover the headers a caller can present a credential in
 * ({@code X-Client-Token}, {@code Authorization}, API-key and cookie headers) and generic
 * secret-ish names.
 */
public final class SensitiveDataRedactor {

    /** Replacement for sensitive values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_FRAGMENTS = Set.of(
            "token", "authorization", "secret", "password", "apikey", "api-key", "credential", "cookie"
    );

    private final Set<String> fragments;
    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_FRAGMENTS);
    }

    /**
     * Creates a redactor for the given key fragments.
     *
     * @param fragments key fragments treated as sensitive (case-insensitive)
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.fragments = Set.copyOf(fragments);
        String regex = String.join("|", this.fragments.stream().map(Pattern::quote).toList());
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of the map with sensitive values replaced by {@value #REDACTED}.
     * Null input yields an empty map; iteration order is preserved.
     *
     * @param data key/value pairs, e.g. request headers
     * @param <V>  value type
     */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    /**
     * Whether the key contains a sensitive fragment.
     */
    public boolean isSensitive(String key) {
        return key != null && pattern.matcher(key).find();
    }

    public Set<String> fragments() {
        return fragments;
    }
}
