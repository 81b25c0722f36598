package com.lionreader.platform.authentication.oauth.panache;

import com.lionreader.platform.authentication.oauth.RefreshToken;
import com.lionreader.platform.authentication.oauth.RefreshTokenRepository;
import com.lionreader.platform.authentication.oauth.entity.RefreshTokenEntity;
import com.lionreader.platform.authentication.oauth.mapper.RefreshTokenMapper;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.Instrumented;
import com.lionreader.platform.shared.TsidGenerator;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of RefreshTokenRepository.
 */
@ApplicationScoped
@Instrumented(table = "oauth_refresh_tokens")
public class PanacheRefreshTokenRepository
    implements RefreshTokenRepository, PanacheRepositoryBase<RefreshTokenEntity, String> {

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(RefreshTokenMapper::toDomain);
    }

    @Override
    public void persist(RefreshToken token) {
        if (token.id == null) {
            token.id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);
        }
        persist(RefreshTokenMapper.toEntity(token));
    }

    @Override
    public boolean claim(String tokenHash, String clientId, Instant now) {
        return update("usedAt = ?1 where tokenHash = ?2 and clientId = ?3"
                + " and usedAt is null and revokedAt is null and expiresAt > ?1",
            now, tokenHash, clientId) == 1;
    }

    @Override
    public void linkReplacement(String id, String replacedById) {
        update("replacedBy = ?1 where id = ?2", replacedById, id);
    }

    @Override
    public int revokeFamily(String tokenFamily, Instant now) {
        return update("revokedAt = ?1 where tokenFamily = ?2 and revokedAt is null", now, tokenFamily);
    }

    @Override
    public int revokeByUserAndClient(String userId, String clientId, Instant now) {
        return update("revokedAt = ?1 where userId = ?2 and clientId = ?3 and revokedAt is null",
            now, userId, clientId);
    }

    @Override
    public long deleteExpiredBefore(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
