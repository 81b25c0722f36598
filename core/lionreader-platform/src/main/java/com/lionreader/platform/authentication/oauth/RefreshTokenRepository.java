package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for refresh tokens.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    /**
     * Atomically mark a live token of this client used.
     *
     * @return true only for the single caller that won the claim
     */
    boolean claim(String tokenHash, String clientId, Instant now);

    void linkReplacement(String id, String replacedById);
    int revokeFamily(String tokenFamily, Instant now);
    int revokeByUserAndClient(String userId, String clientId, Instant now);
    long deleteExpiredBefore(Instant cutoff);
}
