package com.tollgate.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of inbound request headers with names normalized to lower case.
 * <p>
 * Routers hand over headers with whatever casing the client used. Normalizing once here means
 * every later lookup is an exact map hit instead of a case-insensitive scan.
 * <p>
 * When the same name appears twice with different casing, the first non-blank value in
 * iteration order is kept.
 */
public final class RequestHeaders {

    private static final RequestHeaders EMPTY = new RequestHeaders(Map.of());

    private final Map<String, String> values;

    private RequestHeaders(Map<String, String> values) {
        this.values = values;
    }

    /**
     * Builds a normalized view of the given raw header map.
     *
     * @param raw header names to values as received (may be null)
     * @return normalized headers, never null
     */
    public static RequestHeaders of(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> normalized = new LinkedHashMap<>(raw.size());
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String name = normalize(entry.getKey());
            String existing = normalized.get(name);
            if (existing == null || existing.isBlank()) {
                normalized.put(name, entry.getValue());
            }
        }
        return new RequestHeaders(Collections.unmodifiableMap(normalized));
    }

    /** Returns a view with no headers. */
    public static RequestHeaders empty() {
        return EMPTY;
    }

    /**
     * Looks up a header value by name, ignoring case.
     *
     * @param name header name in any casing
     * @return the raw (untrimmed) header value, if present
     */
    public Optional<String> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(normalize(name)));
    }

    /** Returns the normalized header map. */
    public Map<String, String> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    private static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        // header values may carry credentials
        return "RequestHeaders" + values.keySet();
    }
}
