package com.lionreader.platform.authentication.oauth.mapper;

import com.lionreader.platform.authentication.oauth.RefreshToken;
import com.lionreader.platform.authentication.oauth.entity.RefreshTokenEntity;

/**
 * Mapper for converting between RefreshToken domain model and JPA entity.
 */
public final class RefreshTokenMapper {

    private RefreshTokenMapper() {
    }

    public static RefreshToken toDomain(RefreshTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        RefreshToken domain = new RefreshToken();
        domain.id = entity.id;
        domain.tokenHash = entity.tokenHash;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.scopes = ScopeCodec.split(entity.scope);
        domain.resource = entity.resource;
        domain.tokenFamily = entity.tokenFamily;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.usedAt = entity.usedAt;
        domain.revokedAt = entity.revokedAt;
        domain.replacedBy = entity.replacedBy;
        return domain;
    }

    public static RefreshTokenEntity toEntity(RefreshToken domain) {
        if (domain == null) {
            return null;
        }

        RefreshTokenEntity entity = new RefreshTokenEntity();
        entity.id = domain.id;
        entity.tokenHash = domain.tokenHash;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.scope = ScopeCodec.join(domain.scopes);
        entity.resource = domain.resource;
        entity.tokenFamily = domain.tokenFamily;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.usedAt = domain.usedAt;
        entity.revokedAt = domain.revokedAt;
        entity.replacedBy = domain.replacedBy;
        return entity;
    }
}
