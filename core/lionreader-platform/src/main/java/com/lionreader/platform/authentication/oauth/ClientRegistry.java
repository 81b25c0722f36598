package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.SecureTokens;
import com.lionreader.platform.common.Result;
import com.lionreader.platform.common.errors.UseCaseError;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registration and lookup of public OAuth clients.
 */
@ApplicationScoped
public class ClientRegistry {

    private static final Logger LOG = Logger.getLogger(ClientRegistry.class);

    static final int MAX_CLIENT_NAME_LENGTH = 200;
    static final int MAX_REDIRECT_URIS = 10;

    static final List<String> GRANT_TYPES = List.of("authorization_code", "refresh_token");
    static final List<String> RESPONSE_TYPES = List.of(OAuthParameterValidator.RESPONSE_TYPE_CODE);
    static final String AUTH_METHOD_NONE = "none";

    @Inject
    OAuthClientRepository clientRepo;

    @Inject
    OAuthParameterValidator validator;

    public Optional<OAuthClient> resolveClient(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            return Optional.empty();
        }
        return clientRepo.findByClientId(clientId);
    }

    /**
     * Validate metadata and persist a new public client.
     *
     * Failures carry the RFC 7591 error code: invalid_redirect_uri for a bad
     * redirect URI, invalid_client_metadata for everything else.
     */
    @Transactional
    public Result<OAuthClient> registerClient(ClientRegistrationRequest request) {
        if (request == null) {
            return metadataError("Registration body is required");
        }

        String name = request.clientName() == null ? "" : request.clientName().trim();
        if (name.isEmpty()) {
            return metadataError("client_name is required");
        }
        if (name.length() > MAX_CLIENT_NAME_LENGTH) {
            return metadataError("client_name must be at most " + MAX_CLIENT_NAME_LENGTH + " characters");
        }

        List<String> redirectUris = request.redirectUris();
        if (redirectUris == null || redirectUris.isEmpty()) {
            return redirectError("At least one redirect_uri is required");
        }
        if (redirectUris.size() > MAX_REDIRECT_URIS) {
            return redirectError("At most " + MAX_REDIRECT_URIS + " redirect_uris are allowed");
        }
        Set<String> uniqueUris = new LinkedHashSet<>();
        for (String uri : redirectUris) {
            if (!validator.isValidRedirectUriFormat(uri)) {
                return redirectError("Invalid redirect_uri: " + uri);
            }
            uniqueUris.add(uri);
        }

        List<String> scopes = new ArrayList<>();
        if (request.scope() == null || request.scope().isBlank()) {
            scopes.addAll(validator.parseScopes(null));
        } else {
            for (String scope : validator.parseScopes(request.scope())) {
                if (!validator.isSupportedScope(scope)) {
                    return metadataError("Unsupported scope: " + scope);
                }
                scopes.add(scope);
            }
        }

        if (request.grantTypes() != null && !GRANT_TYPES.containsAll(request.grantTypes())) {
            return metadataError("Supported grant_types are " + String.join(", ", GRANT_TYPES));
        }
        if (request.responseTypes() != null && !RESPONSE_TYPES.containsAll(request.responseTypes())) {
            return metadataError("Only response_type code is supported");
        }
        if (request.tokenEndpointAuthMethod() != null
                && !AUTH_METHOD_NONE.equals(request.tokenEndpointAuthMethod())) {
            return metadataError("Only public clients (token_endpoint_auth_method=none) are supported");
        }

        OAuthClient client = new OAuthClient();
        client.clientId = SecureTokens.generateIdentifier();
        client.clientName = name;
        client.redirectUris = new ArrayList<>(uniqueUris);
        client.scopes = scopes;
        client.createdAt = Instant.now();
        clientRepo.persist(client);

        LOG.infof("Registered OAuth client %s (%s) with %d redirect URI(s)",
            client.clientId, client.clientName, client.redirectUris.size());

        return Result.success(client);
    }

    private static Result<OAuthClient> metadataError(String message) {
        return Result.failure(new UseCaseError.ValidationError(
            OAuthError.INVALID_CLIENT_METADATA.code(), message, Map.of()));
    }

    private static Result<OAuthClient> redirectError(String message) {
        return Result.failure(new UseCaseError.ValidationError(
            OAuthError.INVALID_REDIRECT_URI.code(), message, Map.of()));
    }
}
