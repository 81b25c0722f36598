package com.lionreader.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lionreader.platform.authentication.SecureTokens;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * OAuth 2.1 token endpoint for public clients.
 *
 * Supported grants:
 * - authorization_code (with mandatory PKCE verifier)
 * - refresh_token (rotating)
 *
 * Every failure of a code or refresh token is reported as the same
 * invalid_grant; the cause is only logged.
 */
@Path("/oauth/token")
@Tag(name = "OAuth Authorization", description = "OAuth 2.1 authorization code flow endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private static final Logger LOG = Logger.getLogger(TokenResource.class);

    static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    static final String GRANT_REFRESH_TOKEN = "refresh_token";

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    AuthorizationCodeStore codeStore;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    PkceService pkceService;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Exchange an authorization code or refresh token")
    @APIResponse(responseCode = "200", description = "Token pair issued")
    @APIResponse(responseCode = "400", description = "invalid_request, invalid_grant or unsupported_grant_type")
    @APIResponse(responseCode = "401", description = "Unknown client")
    @Transactional
    public Response token(
            @FormParam("grant_type") String grantType,
            @FormParam("code") String code,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("client_id") String clientId,
            @FormParam("code_verifier") String codeVerifier,
            @FormParam("refresh_token") String refreshToken
    ) {
        return handle(new TokenRequest(grantType, code, redirectUri, clientId, codeVerifier, refreshToken));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange an authorization code or refresh token (JSON body)")
    @Transactional
    public Response tokenJson(TokenRequest request) {
        if (request == null) {
            return error(OAuthError.INVALID_REQUEST, "Request body is required");
        }
        return handle(request);
    }

    private Response handle(TokenRequest request) {
        if (isBlank(request.grantType())) {
            return error(OAuthError.INVALID_REQUEST, "grant_type is required");
        }
        if (GRANT_AUTHORIZATION_CODE.equals(request.grantType())) {
            return handleAuthorizationCode(request);
        }
        if (GRANT_REFRESH_TOKEN.equals(request.grantType())) {
            return handleRefreshToken(request);
        }
        return error(OAuthError.UNSUPPORTED_GRANT_TYPE, "Unsupported grant_type: " + request.grantType());
    }

    private Response handleAuthorizationCode(TokenRequest request) {
        if (isBlank(request.code()) || isBlank(request.redirectUri())
                || isBlank(request.clientId()) || isBlank(request.codeVerifier())) {
            return error(OAuthError.INVALID_REQUEST, "code, redirect_uri, client_id and code_verifier are required");
        }
        if (!pkceService.isValidCodeVerifier(request.codeVerifier())) {
            return error(OAuthError.INVALID_REQUEST, "Invalid code_verifier format");
        }
        if (clientRegistry.resolveClient(request.clientId()).isEmpty()) {
            LOG.debugf("Token request from unknown client %s", SecureTokens.truncate(request.clientId()));
            return error(OAuthError.INVALID_CLIENT, "Unknown client");
        }

        Optional<AuthorizationCodeGrant> grant = codeStore.consume(
            request.code(), request.clientId(), request.redirectUri(), request.codeVerifier());
        if (grant.isEmpty()) {
            return error(OAuthError.INVALID_GRANT, "Invalid or expired authorization code");
        }

        AuthorizationCodeGrant g = grant.get();
        TokenPair pair = tokenIssuer.issueTokens(g.clientId(), g.userId(), g.scopes(), g.resource());
        return success(pair);
    }

    private Response handleRefreshToken(TokenRequest request) {
        if (isBlank(request.refreshToken()) || isBlank(request.clientId())) {
            return error(OAuthError.INVALID_REQUEST, "refresh_token and client_id are required");
        }
        if (clientRegistry.resolveClient(request.clientId()).isEmpty()) {
            LOG.debugf("Refresh request from unknown client %s", SecureTokens.truncate(request.clientId()));
            return error(OAuthError.INVALID_CLIENT, "Unknown client");
        }

        return tokenIssuer.rotateRefreshToken(request.refreshToken(), request.clientId())
            .map(this::success)
            .orElseGet(() -> error(OAuthError.INVALID_GRANT, "Invalid or expired refresh token"));
    }

    private Response success(TokenPair pair) {
        return Response.ok(new TokenResponse(
                pair.accessToken(),
                TokenPair.TOKEN_TYPE,
                pair.expiresIn(),
                pair.refreshToken(),
                pair.scope()))
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    private Response error(OAuthError error, String description) {
        Response.Status status = error == OAuthError.INVALID_CLIENT
            ? Response.Status.UNAUTHORIZED
            : Response.Status.BAD_REQUEST;
        Map<String, String> body = error.body(description);
        return Response.status(status)
            .entity(body)
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Token request fields, shared by the form and JSON bodies.
     */
    public record TokenRequest(
        @JsonProperty("grant_type") String grantType,
        @JsonProperty("code") String code,
        @JsonProperty("redirect_uri") String redirectUri,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("code_verifier") String codeVerifier,
        @JsonProperty("refresh_token") String refreshToken
    ) {
    }

    public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("scope") String scope
    ) {
    }
}
