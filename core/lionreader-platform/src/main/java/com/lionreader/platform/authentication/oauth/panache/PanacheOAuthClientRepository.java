package com.lionreader.platform.authentication.oauth.panache;

import com.lionreader.platform.authentication.oauth.OAuthClient;
import com.lionreader.platform.authentication.oauth.OAuthClientRepository;
import com.lionreader.platform.authentication.oauth.entity.OAuthClientEntity;
import com.lionreader.platform.authentication.oauth.mapper.OAuthClientMapper;
import com.lionreader.platform.shared.EntityType;
import com.lionreader.platform.shared.Instrumented;
import com.lionreader.platform.shared.TsidGenerator;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of OAuthClientRepository.
 */
@ApplicationScoped
@Instrumented(table = "oauth_clients")
public class PanacheOAuthClientRepository
    implements OAuthClientRepository, PanacheRepositoryBase<OAuthClientEntity, String> {

    @Override
    public Optional<OAuthClient> findByClientId(String clientId) {
        return find("clientId", clientId)
            .firstResultOptional()
            .map(OAuthClientMapper::toDomain);
    }

    @Override
    public void persist(OAuthClient client) {
        if (client.id == null) {
            client.id = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        }
        if (client.createdAt == null) {
            client.createdAt = Instant.now();
        }
        persist(OAuthClientMapper.toEntity(client));
    }
}
