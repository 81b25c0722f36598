package com.lionreader.platform.authentication.oauth.mapper;

import com.lionreader.platform.authentication.oauth.OAuthClient;
import com.lionreader.platform.authentication.oauth.entity.OAuthClientEntity;

import java.util.ArrayList;

/**
 * Mapper for converting between OAuthClient domain model and JPA entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.clientName = entity.clientName;
        domain.redirectUris = new ArrayList<>(entity.redirectUris);
        domain.scopes = new ArrayList<>(entity.scopes);
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        entity.clientName = domain.clientName;
        entity.redirectUris = new ArrayList<>(domain.redirectUris);
        entity.scopes = new ArrayList<>(domain.scopes);
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
