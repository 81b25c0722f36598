package com.lionreader.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Describes the access token presented by the caller.
 */
@Path("/oauth/tokeninfo")
@Tag(name = "OAuth Authorization", description = "OAuth 2.1 authorization code flow endpoints")
@Produces(MediaType.APPLICATION_JSON)
@BearerTokenRequired
public class TokenInfoResource {

    @Inject
    BearerTokenContext bearerTokenContext;

    @GET
    @Operation(summary = "Inspect the caller's access token")
    @APIResponse(responseCode = "200", description = "Token is valid")
    @APIResponse(responseCode = "401", description = "Missing, expired or revoked token")
    public TokenInfoResponse tokenInfo() {
        AccessTokenInfo token = bearerTokenContext.token();
        return new TokenInfoResponse(token.userId(), token.clientId(), String.join(" ", token.scopes()), token.resource());
    }

    public record TokenInfoResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("client_id") String clientId,
        @JsonProperty("scope") String scope,
        @JsonProperty("resource") String resource
    ) {
    }
}
