package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import com.lionreader.platform.authentication.SecureTokens;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Issues and redeems single-use authorization codes.
 *
 * Redemption is atomic: of any number of concurrent attempts with the same
 * code, at most one succeeds. Every failure looks the same to the caller;
 * the reason is only logged.
 */
@ApplicationScoped
public class AuthorizationCodeStore {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeStore.class);

    static final Duration MAX_CODE_LIFETIME = Duration.ofMinutes(10);

    @Inject
    AuthorizationCodeRepository codeRepo;

    @Inject
    PkceService pkceService;

    @Inject
    AuthConfig authConfig;

    /**
     * Create a code bound to the client, user, redirect URI, scopes and PKCE challenge.
     *
     * @return the plain code value; only its hash is stored
     */
    @Transactional
    public String issue(String clientId, String userId, String redirectUri, List<String> scopes,
                        String codeChallenge, String resource, String state) {
        String code = SecureTokens.generate();
        Instant now = Instant.now();

        AuthorizationCode authCode = new AuthorizationCode();
        authCode.codeHash = SecureTokens.hash(code);
        authCode.clientId = clientId;
        authCode.userId = userId;
        authCode.redirectUri = redirectUri;
        authCode.scopes = new ArrayList<>(scopes);
        authCode.codeChallenge = codeChallenge;
        authCode.codeChallengeMethod = PkceService.METHOD_S256;
        authCode.resource = resource;
        authCode.state = state;
        authCode.createdAt = now;
        authCode.expiresAt = now.plus(codeLifetime());
        codeRepo.persist(authCode);

        LOG.debugf("Issued authorization code %s for client %s",
            SecureTokens.fingerprint(code), SecureTokens.truncate(clientId));
        return code;
    }

    /**
     * Redeem a code. Client id, redirect URI and PKCE verifier must all match
     * what was bound at issuance, and the code must be unused and unexpired.
     *
     * A PKCE mismatch does not burn the code.
     */
    @Transactional
    public Optional<AuthorizationCodeGrant> consume(String code, String clientId, String redirectUri,
                                                    String codeVerifier) {
        if (code == null || clientId == null || redirectUri == null || codeVerifier == null) {
            return Optional.empty();
        }
        String fingerprint = SecureTokens.fingerprint(code);

        Optional<AuthorizationCode> found = codeRepo.findByCodeHash(SecureTokens.hash(code));
        if (found.isEmpty()) {
            LOG.debugf("Authorization code %s not found", fingerprint);
            return Optional.empty();
        }
        AuthorizationCode authCode = found.get();

        if (authCode.isUsed()) {
            LOG.warnf("Authorization code %s replayed by client %s", fingerprint, SecureTokens.truncate(clientId));
            return Optional.empty();
        }
        if (authCode.isExpired()) {
            LOG.debugf("Authorization code %s expired", fingerprint);
            return Optional.empty();
        }
        if (!authCode.clientId.equals(clientId)) {
            LOG.warnf("Authorization code %s presented by wrong client %s", fingerprint, SecureTokens.truncate(clientId));
            return Optional.empty();
        }
        if (!authCode.redirectUri.equals(redirectUri)) {
            LOG.warnf("Authorization code %s presented with mismatched redirect_uri", fingerprint);
            return Optional.empty();
        }
        if (!pkceService.verifyCodeChallenge(codeVerifier, authCode.codeChallenge)) {
            LOG.warnf("Authorization code %s failed PKCE verification", fingerprint);
            return Optional.empty();
        }

        boolean claimed;
        try {
            claimed = codeRepo.claim(authCode.id, Instant.now());
        } catch (PersistenceException e) {
            LOG.warnf("Authorization code %s claim failed: %s", fingerprint, e.getMessage());
            return Optional.empty();
        }
        if (!claimed) {
            LOG.warnf("Authorization code %s was redeemed concurrently", fingerprint);
            return Optional.empty();
        }

        return Optional.of(new AuthorizationCodeGrant(
            authCode.userId, authCode.clientId, List.copyOf(authCode.scopes), authCode.resource));
    }

    private Duration codeLifetime() {
        Duration configured = authConfig.oauth().authorizationCodeExpiry();
        return configured.compareTo(MAX_CODE_LIFETIME) > 0 ? MAX_CODE_LIFETIME : configured;
    }
}
