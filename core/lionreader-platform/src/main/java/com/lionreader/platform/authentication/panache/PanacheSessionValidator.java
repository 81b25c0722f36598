package com.lionreader.platform.authentication.panache;

import com.lionreader.platform.authentication.SecureTokens;
import com.lionreader.platform.authentication.SessionValidator;
import com.lionreader.platform.authentication.entity.UserSessionEntity;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based session lookup against the login system's sessions table.
 */
@ApplicationScoped
public class PanacheSessionValidator
    implements SessionValidator, PanacheRepositoryBase<UserSessionEntity, String> {

    @Override
    public Optional<String> validateSession(String sessionToken) {
        if (sessionToken == null || sessionToken.isEmpty()) {
            return Optional.empty();
        }
        return find("tokenHash = ?1 and revokedAt is null and expiresAt > ?2",
                SecureTokens.hash(sessionToken), Instant.now())
            .firstResultOptional()
            .map(session -> session.userId);
    }
}
