package com.tollgate.security;

import java.util.Optional;

/**
 * Extracts the presented client credential from request headers.
 * <p>
 * Two sources are consulted, in order:
 * <ol>
 *   <li>the designated client-token header (default {@value #DEFAULT_HEADER_NAME}), trimmed</li>
 *   <li>the {@code Authorization} header, only when it starts with the literal {@code "Bearer "}</li>
 * </ol>
 * An all-whitespace value counts as absent. The first source wins when both are present.
 */
public final class CredentialExtractor {

    /** Default name of the client-token header. */
    public static final String DEFAULT_HEADER_NAME = "X-Client-Token";

    /** Standard authorization header consulted as a fallback. */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    /** Scheme prefix, including the separating space. Matched case-sensitively. */
    public static final String BEARER_PREFIX = "Bearer ";

    private final String headerName;

    /**
     * Creates an extractor reading the default client-token header.
     */
    public CredentialExtractor() {
        this(DEFAULT_HEADER_NAME);
    }

    /**
     * Creates an extractor reading a custom client-token header.
     *
     * @param headerName name of the primary credential header (case is irrelevant)
     */
    public CredentialExtractor(String headerName) {
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("headerName must not be null or blank");
        }
        this.headerName = headerName.strip();
    }

    /**
     * Returns the presented credential, or empty when none was supplied.
     *
     * @param headers normalized request headers
     * @return the trimmed credential, or empty if absent
     */
    public Optional<String> extract(RequestHeaders headers) {
        if (headers == null || headers.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> primary = headers.get(headerName)
                .map(String::strip)
                .filter(value -> !value.isEmpty());
        if (primary.isPresent()) {
            return primary;
        }
        return headers.get(AUTHORIZATION_HEADER).flatMap(CredentialExtractor::bearerToken);
    }

    /**
     * Parses a {@code "Bearer <token>"} value.
     * <p>
     * Unlike generic bearer parsing, the prefix must match exactly, space included:
     * {@code "bearer abc"} and {@code "Bearer"} both yield empty.
     *
     * @param authorization raw Authorization header value (may be null)
     * @return the trimmed token, or empty if the prefix is missing or nothing follows it
     */
    static Optional<String> bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorization.substring(BEARER_PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /** Returns the configured primary header name. */
    public String headerName() {
        return headerName;
    }
}
