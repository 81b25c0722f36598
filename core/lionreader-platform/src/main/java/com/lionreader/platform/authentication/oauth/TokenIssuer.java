package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import com.lionreader.platform.authentication.SecureTokens;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.TsidGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mints, rotates, validates and revokes opaque bearer tokens.
 *
 * Refresh tokens rotate on every use. Presenting a token that was already
 * rotated is treated as theft: the whole family (every access and refresh
 * token descended from the same authorization code) is revoked.
 */
@ApplicationScoped
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    @Inject
    AccessTokenRepository accessTokenRepo;

    @Inject
    RefreshTokenRepository refreshTokenRepo;

    @Inject
    AuthConfig authConfig;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Issue a fresh pair in a new token family.
     */
    @Transactional
    public TokenPair issueTokens(String clientId, String userId, List<String> scopes, String resource) {
        String family = TsidGenerator.generate(EntityType.TOKEN_FAMILY);
        MintedTokens minted = mint(clientId, userId, scopes, resource, family);
        meterRegistry.counter("lionreader.oauth.tokens.issued", "grant_type", "authorization_code").increment();
        LOG.infof("Issued tokens for client %s, user %s, family %s",
            SecureTokens.truncate(clientId), SecureTokens.truncate(userId), family);
        return minted.pair();
    }

    /**
     * Exchange a live refresh token for a new pair with the same user,
     * scopes and resource. Of concurrent attempts with the same token,
     * at most one succeeds.
     *
     * <p>A losing concurrent attempt finds the token already used and treats
     * it as reuse, so the whole family is revoked, including the pair the
     * winner just received. A legitimate client that sends two refreshes in
     * parallel is therefore logged out and must authorize again.
     *
     * @return empty when the token is unknown, expired, revoked, already used
     *         or belongs to another client
     */
    @Transactional
    public Optional<TokenPair> rotateRefreshToken(String refreshToken, String clientId) {
        if (refreshToken == null || clientId == null) {
            return Optional.empty();
        }
        String tokenHash = SecureTokens.hash(refreshToken);
        String fingerprint = SecureTokens.fingerprint(refreshToken);
        Instant now = Instant.now();

        boolean claimed;
        try {
            claimed = refreshTokenRepo.claim(tokenHash, clientId, now);
            if (!claimed) {
                refreshTokenRepo.findByTokenHash(tokenHash)
                    .filter(RefreshToken::isUsed)
                    .ifPresent(used -> revokeFamilyOnReuse(used, fingerprint, now));
            }
        } catch (PersistenceException e) {
            LOG.warnf("Refresh token %s claim failed: %s", fingerprint, e.getMessage());
            return Optional.empty();
        }
        if (!claimed) {
            return Optional.empty();
        }

        RefreshToken old = refreshTokenRepo.findByTokenHash(tokenHash)
            .orElseThrow(() -> new IllegalStateException("Claimed refresh token disappeared"));
        MintedTokens minted = mint(old.clientId, old.userId, old.scopes, old.resource, old.tokenFamily);
        refreshTokenRepo.linkReplacement(old.id, minted.refreshTokenId());

        meterRegistry.counter("lionreader.oauth.tokens.issued", "grant_type", "refresh_token").increment();
        LOG.debugf("Rotated refresh token %s in family %s", fingerprint, old.tokenFamily);
        return Optional.of(minted.pair());
    }

    /**
     * Resolve a bearer access token. Records last use on success.
     */
    @Transactional
    public Optional<AccessTokenInfo> validateAccessToken(String accessToken) {
        if (accessToken == null || accessToken.isEmpty()) {
            return Optional.empty();
        }
        Optional<AccessToken> found = accessTokenRepo.findByTokenHash(SecureTokens.hash(accessToken))
            .filter(AccessToken::isValid);
        if (found.isEmpty()) {
            LOG.debugf("Access token %s rejected", SecureTokens.fingerprint(accessToken));
            return Optional.empty();
        }
        AccessToken token = found.get();
        accessTokenRepo.markUsed(token.id, Instant.now());
        return Optional.of(new AccessTokenInfo(token.userId, token.clientId, List.copyOf(token.scopes), token.resource));
    }

    /**
     * Revoke every access and refresh token a user holds for a client.
     */
    @Transactional
    public void revokeClientTokens(String userId, String clientId) {
        Instant now = Instant.now();
        int access = accessTokenRepo.revokeByUserAndClient(userId, clientId, now);
        int refresh = refreshTokenRepo.revokeByUserAndClient(userId, clientId, now);
        LOG.infof("Revoked %d access and %d refresh tokens of user %s for client %s",
            access, refresh, SecureTokens.truncate(userId), SecureTokens.truncate(clientId));
    }

    private void revokeFamilyOnReuse(RefreshToken used, String fingerprint, Instant now) {
        int refresh = refreshTokenRepo.revokeFamily(used.tokenFamily, now);
        int access = accessTokenRepo.revokeFamily(used.tokenFamily, now);
        meterRegistry.counter("lionreader.oauth.refresh.reuse_detected").increment();
        LOG.warnf("Refresh token %s reused by client %s; revoked family %s (%d refresh, %d access tokens)",
            fingerprint, SecureTokens.truncate(used.clientId), used.tokenFamily, refresh, access);
    }

    private MintedTokens mint(String clientId, String userId, List<String> scopes, String resource, String family) {
        Instant now = Instant.now();
        String accessValue = SecureTokens.generate();
        String refreshValue = SecureTokens.generate();

        AccessToken access = new AccessToken();
        access.tokenHash = SecureTokens.hash(accessValue);
        access.clientId = clientId;
        access.userId = userId;
        access.scopes = new ArrayList<>(scopes);
        access.resource = resource;
        access.tokenFamily = family;
        access.createdAt = now;
        access.expiresAt = now.plus(authConfig.oauth().accessTokenExpiry());
        accessTokenRepo.persist(access);

        RefreshToken refresh = new RefreshToken();
        refresh.tokenHash = SecureTokens.hash(refreshValue);
        refresh.clientId = clientId;
        refresh.userId = userId;
        refresh.scopes = new ArrayList<>(scopes);
        refresh.resource = resource;
        refresh.tokenFamily = family;
        refresh.createdAt = now;
        refresh.expiresAt = now.plus(authConfig.oauth().refreshTokenExpiry());
        refreshTokenRepo.persist(refresh);

        TokenPair pair = new TokenPair(accessValue, refreshValue,
            authConfig.oauth().accessTokenExpiry().toSeconds(), List.copyOf(scopes));
        return new MintedTokens(pair, refresh.id);
    }

    private record MintedTokens(TokenPair pair, String refreshTokenId) {
    }
}
