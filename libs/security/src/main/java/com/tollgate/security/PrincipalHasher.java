package com.tollgate.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives a pseudonymous principal id from a validated credential.
 * <p>
 * The id is {@code "user-"} followed by the first 16 hex characters (64 bits) of the SHA-256
 * digest of the credential. It correlates audit log lines without exposing the credential and
 * is never used for the authorization decision itself.
 */
public final class PrincipalHasher {

    /** Prefix carried by every principal id. */
    public static final String PREFIX = "user-";

    /** Number of hex characters kept from the digest. */
    public static final int HEX_LENGTH = 16;

    private PrincipalHasher() {
        // utility class
    }

    /**
     * Hashes a credential into a principal id.
     *
     * @param credential the validated credential (must not be null)
     * @return {@code "user-"} plus 16 lower-case hex characters
     */
    public static String hash(String credential) {
        if (credential == null) {
            throw new IllegalArgumentException("credential must not be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(credential.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(hash, 0, HEX_LENGTH / 2);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is not available", e);
        }
    }
}
