package com.lionreader.platform.authentication.oauth.panache;

import com.lionreader.platform.authentication.oauth.ConsentGrant;
import com.lionreader.platform.authentication.oauth.ConsentGrantRepository;
import com.lionreader.platform.authentication.oauth.entity.ConsentGrantEntity;
import com.lionreader.platform.authentication.oauth.mapper.ConsentGrantMapper;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.Instrumented;
import com.lionreader.platform.shared.TsidGenerator;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of ConsentGrantRepository.
 */
@ApplicationScoped
@Instrumented(table = "oauth_consent_grants")
public class PanacheConsentGrantRepository
    implements ConsentGrantRepository, PanacheRepositoryBase<ConsentGrantEntity, String> {

    @Override
    public Optional<ConsentGrant> findByUserAndClient(String userId, String clientId) {
        return find("userId = ?1 and clientId = ?2", userId, clientId)
            .firstResultOptional()
            .map(ConsentGrantMapper::toDomain);
    }

    @Override
    public List<ConsentGrant> findActiveByUser(String userId) {
        return list("userId = ?1 and revokedAt is null order by createdAt", userId)
            .stream()
            .map(ConsentGrantMapper::toDomain)
            .toList();
    }

    @Override
    public Optional<ConsentGrant> findByUserAndClientForUpdate(String userId, String clientId) {
        return find("userId = ?1 and clientId = ?2", userId, clientId)
            .withLock(LockModeType.PESSIMISTIC_WRITE)
            .firstResultOptional()
            .map(ConsentGrantMapper::toDomain);
    }

    @Override
    public void persist(ConsentGrant grant) {
        if (grant.id == null) {
            grant.id = TsidGenerator.generate(EntityType.CONSENT_GRANT);
        }
        persist(ConsentGrantMapper.toEntity(grant));
    }

    @Override
    public void update(ConsentGrant grant) {
        ConsentGrantEntity entity = findById(grant.id);
        if (entity != null) {
            ConsentGrantMapper.updateEntity(entity, grant);
        }
    }

    @Override
    public boolean revoke(String userId, String clientId, Instant now) {
        return update("revokedAt = ?1, updatedAt = ?1 where userId = ?2 and clientId = ?3 and revokedAt is null",
            now, userId, clientId) > 0;
    }
}
