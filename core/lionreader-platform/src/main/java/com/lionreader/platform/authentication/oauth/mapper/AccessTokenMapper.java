package com.lionreader.platform.authentication.oauth.mapper;

import com.lionreader.platform.authentication.oauth.AccessToken;
import com.lionreader.platform.authentication.oauth.entity.AccessTokenEntity;

/**
 * Mapper for converting between AccessToken domain model and JPA entity.
 */
public final class AccessTokenMapper {

    private AccessTokenMapper() {
    }

    public static AccessToken toDomain(AccessTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        AccessToken domain = new AccessToken();
        domain.id = entity.id;
        domain.tokenHash = entity.tokenHash;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.scopes = ScopeCodec.split(entity.scope);
        domain.resource = entity.resource;
        domain.tokenFamily = entity.tokenFamily;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.revokedAt = entity.revokedAt;
        domain.lastUsedAt = entity.lastUsedAt;
        return domain;
    }

    public static AccessTokenEntity toEntity(AccessToken domain) {
        if (domain == null) {
            return null;
        }

        AccessTokenEntity entity = new AccessTokenEntity();
        entity.id = domain.id;
        entity.tokenHash = domain.tokenHash;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.scope = ScopeCodec.join(domain.scopes);
        entity.resource = domain.resource;
        entity.tokenFamily = domain.tokenFamily;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.revokedAt = domain.revokedAt;
        entity.lastUsedAt = domain.lastUsedAt;
        return entity;
    }
}
