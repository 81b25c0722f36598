package com.lionreader.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange) with the S256 method only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client sends code_challenge = BASE64URL(SHA256(code_verifier)) to /oauth/authorize
 * 3. Server stores code_challenge with the authorization code
 * 4. Client sends code_verifier to /oauth/token
 * 5. Server recomputes the challenge and compares in constant time
 *
 * The "plain" method is rejected: OAuth 2.1 requires S256 for all clients.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final int MIN_LENGTH = 43;
    private static final int MAX_LENGTH = 128;

    private static final Pattern VERIFIER_CHARS = Pattern.compile("^[A-Za-z0-9\\-._~]+$");
    private static final Pattern CHALLENGE_CHARS = Pattern.compile("^[A-Za-z0-9\\-_]+$");

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier))), no padding.
     */
    public String computeCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Check a verifier against the stored challenge.
     *
     * @return false for any malformed verifier, never throws
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge) {
        if (!isValidCodeVerifier(codeVerifier) || codeChallenge == null) {
            return false;
        }
        String computed = computeCodeChallenge(codeVerifier);
        return MessageDigest.isEqual(
            computed.getBytes(StandardCharsets.US_ASCII),
            codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * 43-128 characters of the base64url alphabet.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return hasValidLength(codeChallenge) && CHALLENGE_CHARS.matcher(codeChallenge).matches();
    }

    /**
     * 43-128 unreserved URI characters [A-Za-z0-9-._~].
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return hasValidLength(codeVerifier) && VERIFIER_CHARS.matcher(codeVerifier).matches();
    }

    private boolean hasValidLength(String value) {
        return value != null && value.length() >= MIN_LENGTH && value.length() <= MAX_LENGTH;
    }
}
