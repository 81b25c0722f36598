package com.lionreader.platform.authentication.oauth;

import java.util.Optional;

/**
 * Repository interface for registered OAuth clients.
 */
public interface OAuthClientRepository {

    Optional<OAuthClient> findByClientId(String clientId);

    void persist(OAuthClient client);
}
