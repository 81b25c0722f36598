package com.lionreader.platform.authentication.oauth;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for authorization codes.
 */
public interface AuthorizationCodeRepository {

    Optional<AuthorizationCode> findByCodeHash(String codeHash);

    void persist(AuthorizationCode authCode);

    /**
     * Atomically mark the code used if it is still unused and unexpired.
     *
     * @return true only for the single caller that won the claim
     */
    boolean claim(String id, Instant now);

    /**
     * Delete codes that expired before the cutoff.
     */
    long deleteExpiredBefore(Instant cutoff);
}
