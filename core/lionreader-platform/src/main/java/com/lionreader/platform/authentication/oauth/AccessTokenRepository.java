package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for access tokens.
 */
public interface AccessTokenRepository {

    // Read operations
    Optional<AccessToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(AccessToken token);
    void markUsed(String id, Instant now);
    int revokeFamily(String tokenFamily, Instant now);
    int revokeByUserAndClient(String userId, String clientId, Instant now);
    long deleteExpiredBefore(Instant cutoff);
}
