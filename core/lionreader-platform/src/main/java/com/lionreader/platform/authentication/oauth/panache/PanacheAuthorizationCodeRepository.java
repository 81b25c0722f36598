package com.lionreader.platform.authentication.oauth.panache;

import com.lionreader.platform.authentication.oauth.AuthorizationCode;
import com.lionreader.platform.authentication.oauth.AuthorizationCodeRepository;
import com.lionreader.platform.authentication.oauth.entity.AuthorizationCodeEntity;
import com.lionreader.platform.authentication.oauth.mapper.AuthorizationCodeMapper;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.Instrumented;
import com.lionreader.platform.shared.TsidGenerator;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of AuthorizationCodeRepository.
 */
@ApplicationScoped
@Instrumented(table = "oauth_authorization_codes")
public class PanacheAuthorizationCodeRepository
    implements AuthorizationCodeRepository, PanacheRepositoryBase<AuthorizationCodeEntity, String> {

    @Override
    public Optional<AuthorizationCode> findByCodeHash(String codeHash) {
        return find("codeHash", codeHash)
            .firstResultOptional()
            .map(AuthorizationCodeMapper::toDomain);
    }

    @Override
    public void persist(AuthorizationCode authCode) {
        if (authCode.id == null) {
            authCode.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        }
        if (authCode.createdAt == null) {
            authCode.createdAt = Instant.now();
        }
        persist(AuthorizationCodeMapper.toEntity(authCode));
    }

    @Override
    public boolean claim(String id, Instant now) {
        return update("usedAt = ?1 where id = ?2 and usedAt is null and expiresAt > ?1", now, id) == 1;
    }

    @Override
    public long deleteExpiredBefore(Instant cutoff) {
        return delete("expiresAt < ?1", cutoff);
    }
}
