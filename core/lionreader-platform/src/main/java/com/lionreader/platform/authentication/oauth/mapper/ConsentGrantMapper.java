package com.lionreader.platform.authentication.oauth.mapper;

import com.lionreader.platform.authentication.oauth.ConsentGrant;
import com.lionreader.platform.authentication.oauth.entity.ConsentGrantEntity;

/**
 * Mapper for converting between ConsentGrant domain model and JPA entity.
 */
public final class ConsentGrantMapper {

    private ConsentGrantMapper() {
    }

    public static ConsentGrant toDomain(ConsentGrantEntity entity) {
        if (entity == null) {
            return null;
        }

        ConsentGrant domain = new ConsentGrant();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.clientId = entity.clientId;
        domain.scopes = ScopeCodec.split(entity.scope);
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        domain.revokedAt = entity.revokedAt;
        return domain;
    }

    public static ConsentGrantEntity toEntity(ConsentGrant domain) {
        if (domain == null) {
            return null;
        }

        ConsentGrantEntity entity = new ConsentGrantEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.clientId = domain.clientId;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(ConsentGrantEntity entity, ConsentGrant domain) {
        entity.scope = ScopeCodec.join(domain.scopes);
        entity.updatedAt = domain.updatedAt;
        entity.revokedAt = domain.revokedAt;
    }
}
