package com.lionreader.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lionreader.platform.authentication.AuthConfig;
import com.lionreader.platform.authentication.SessionValidator;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Connected apps: the signed-in user's consent grants.
 */
@Path("/oauth/consents")
@Tag(name = "OAuth Consents", description = "Manage apps the user has authorized")
@Produces(MediaType.APPLICATION_JSON)
public class ConsentResource {

    @Inject
    ConsentLedger consentLedger;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    SessionValidator sessionValidator;

    @Inject
    AuthConfig authConfig;

    @Context
    HttpHeaders httpHeaders;

    @GET
    @Operation(summary = "List authorized apps")
    @APIResponse(responseCode = "200", description = "Active consent grants")
    @APIResponse(responseCode = "401", description = "Not authenticated")
    public Response list() {
        Optional<String> userId = currentUser();
        if (userId.isEmpty()) {
            return unauthorized();
        }
        List<ConsentView> grants = consentLedger.listConsents(userId.get()).stream()
            .map(grant -> new ConsentView(
                grant.clientId,
                clientRegistry.resolveClient(grant.clientId).map(c -> c.clientName).orElse(null),
                String.join(" ", grant.scopes),
                grant.createdAt,
                grant.updatedAt))
            .toList();
        return Response.ok(grants).build();
    }

    @DELETE
    @Path("/{clientId}")
    @Operation(summary = "Revoke an app's access",
        description = "Revokes the consent grant and every token the user holds for the client")
    @APIResponse(responseCode = "204", description = "Revoked")
    @APIResponse(responseCode = "404", description = "No active grant for this client")
    public Response revoke(@PathParam("clientId") String clientId) {
        Optional<String> userId = currentUser();
        if (userId.isEmpty()) {
            return unauthorized();
        }
        if (!consentLedger.revokeConsent(userId.get(), clientId)) {
            return Response.status(Response.Status.NOT_FOUND)
                .entity(OAuthError.INVALID_REQUEST.body("No active consent for this client"))
                .build();
        }
        return Response.noContent().build();
    }

    private Optional<String> currentUser() {
        Cookie cookie = httpHeaders.getCookies().get(authConfig.session().cookieName());
        return sessionValidator.validateSession(cookie == null ? null : cookie.getValue());
    }

    private Response unauthorized() {
        return Response.status(Response.Status.UNAUTHORIZED)
            .entity(OAuthError.ACCESS_DENIED.body("Not authenticated"))
            .build();
    }

    public record ConsentView(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_name") String clientName,
        @JsonProperty("scope") String scope,
        @JsonProperty("granted_at") Instant grantedAt,
        @JsonProperty("updated_at") Instant updatedAt
    ) {
    }
}
