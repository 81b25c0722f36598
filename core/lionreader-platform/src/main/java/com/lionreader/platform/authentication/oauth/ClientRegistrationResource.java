package com.lionreader.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lionreader.platform.common.Result;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.Map;

/**
 * Open dynamic client registration (RFC 7591). Registered clients are public
 * and authenticate with PKCE only.
 */
@Path("/oauth/register")
@Tag(name = "OAuth Client Registration", description = "Dynamic client registration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ClientRegistrationResource {

    @Inject
    ClientRegistry clientRegistry;

    @POST
    @Operation(summary = "Register a public OAuth client")
    @APIResponse(responseCode = "201", description = "Client registered")
    @APIResponse(responseCode = "400", description = "invalid_client_metadata or invalid_redirect_uri")
    public Response register(ClientRegistrationRequest request) {
        Result<OAuthClient> result = clientRegistry.registerClient(request);

        if (result instanceof Result.Failure<OAuthClient> failure) {
            return Response.status(Response.Status.BAD_REQUEST)
                .entity(Map.of(
                    "error", failure.error().code(),
                    "error_description", failure.error().message()))
                .header("Cache-Control", "no-store")
                .build();
        }

        OAuthClient client = ((Result.Success<OAuthClient>) result).value();
        return Response.status(Response.Status.CREATED)
            .entity(ClientRegistrationResponse.from(client))
            .header("Cache-Control", "no-store")
            .build();
    }

    public record ClientRegistrationResponse(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("scope") String scope,
        @JsonProperty("grant_types") List<String> grantTypes,
        @JsonProperty("response_types") List<String> responseTypes,
        @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
        @JsonProperty("client_id_issued_at") long clientIdIssuedAt
    ) {
        static ClientRegistrationResponse from(OAuthClient client) {
            return new ClientRegistrationResponse(
                client.clientId,
                client.clientName,
                List.copyOf(client.redirectUris),
                String.join(" ", client.scopes),
                ClientRegistry.GRANT_TYPES,
                ClientRegistry.RESPONSE_TYPES,
                ClientRegistry.AUTH_METHOD_NONE,
                client.createdAt.getEpochSecond());
        }
    }
}
