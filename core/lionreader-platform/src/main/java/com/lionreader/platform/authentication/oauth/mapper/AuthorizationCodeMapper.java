package com.lionreader.platform.authentication.oauth.mapper;

import com.lionreader.platform.authentication.oauth.AuthorizationCode;
import com.lionreader.platform.authentication.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain model and JPA entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.codeHash = entity.codeHash;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.redirectUri = entity.redirectUri;
        domain.scopes = ScopeCodec.split(entity.scope);
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.resource = entity.resource;
        domain.state = entity.state;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.usedAt = entity.usedAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.codeHash = domain.codeHash;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.redirectUri = domain.redirectUri;
        entity.scope = ScopeCodec.join(domain.scopes);
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.resource = domain.resource;
        entity.state = domain.state;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.usedAt = domain.usedAt;
        return entity;
    }
}
