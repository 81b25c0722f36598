package com.lionreader.platform.authentication.oauth.panache;

import com.lionreader.platform.authentication.oauth.AccessToken;
import com.lionreader.platform.authentication.oauth.AccessTokenRepository;
import com.lionreader.platform.authentication.oauth.entity.AccessTokenEntity;
import com.lionreader.platform.authentication.oauth.mapper.AccessTokenMapper;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.Instrumented;
import com.lionreader.platform.shared.TsidGenerator;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AccessTokenRepository.
 */
@ApplicationScoped
@Instrumented(table = "oauth_access_tokens")
public class PanacheAccessTokenRepository
    implements AccessTokenRepository, PanacheRepositoryBase<AccessTokenEntity, String> {

    @Override
    public Optional<AccessToken> findByTokenHash(String tokenHash) {
        return find("tokenHash", tokenHash)
            .firstResultOptional()
            .map(AccessTokenMapper::toDomain);
    }

    @Override
    public void persist(AccessToken token) {
        if (token.id == null) {
            token.id = TsidGenerator.generate(EntityType.ACCESS_TOKEN);
        }
        persist(AccessTokenMapper.toEntity(token));
    }

    @Override
    public void markUsed(String id, Instant now) {
        update("lastUsedAt = ?1 where id = ?2", now, id);
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
