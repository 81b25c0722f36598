package com.lionreader.platform.authentication;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generation and hashing of opaque bearer secrets (authorization codes,
 * access and refresh tokens, session tokens).
 *
 * Only the SHA-256 hash of a secret is ever stored. Logs identify a secret
 * by {@link #fingerprint(String)}, never by its value.
 */
public final class SecureTokens {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;
    private static final int IDENTIFIER_BYTES = 16;
    private static final int FINGERPRINT_LENGTH = 8;

    /**
     * 256 bits of randomness, base64url encoded without padding (43 characters).
     */
    public static String generate() {
        return randomUrlSafe(TOKEN_BYTES);
    }

    /**
     * 128 bits of randomness for public, non-secret identifiers such as client ids.
     */
    public static String generateIdentifier() {
        return randomUrlSafe(IDENTIFIER_BYTES);
    }

    /**
     * Lowercase hex SHA-256 of the UTF-8 bytes of the secret.
     */
    public static String hash(String token) {
        return HexFormat.of().formatHex(sha256(token.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Short, non-reversible identifier safe for logs.
     */
    public static String fingerprint(String token) {
        if (token == null || token.isEmpty()) {
            return "-";
        }
        return hash(token).substring(0, FINGERPRINT_LENGTH);
    }

    /**
     * Shortens an identifier that is not secret (client ids, user ids) for logs.
     */
    public static String truncate(String value) {
        if (value == null) {
            return "-";
        }
        return value.length() <= 24 ? value : value.substring(0, 24) + "...";
    }

    private static String randomUrlSafe(int length) {
        byte[] bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private SecureTokens() {
    }
}
