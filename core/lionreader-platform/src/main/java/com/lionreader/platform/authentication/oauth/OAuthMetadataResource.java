package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery documents for OAuth clients and MCP clients.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8414">RFC 8414 - Authorization Server Metadata</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc9728">RFC 9728 - Protected Resource Metadata</a>
 */
@Path("/.well-known")
@Tag(name = "OAuth Discovery", description = "Authorization server and protected resource metadata")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthMetadataResource {

    @Inject
    AuthConfig authConfig;

    @Inject
    OAuthParameterValidator validator;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/oauth-authorization-server")
    @Operation(summary = "Authorization server metadata")
    public Map<String, Object> authorizationServer() {
        String issuer = issuer();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("issuer", issuer);
        metadata.put("authorization_endpoint", issuer + "/oauth/authorize");
        metadata.put("token_endpoint", issuer + "/oauth/token");
        metadata.put("registration_endpoint", issuer + "/oauth/register");
        metadata.put("response_types_supported", List.of(OAuthParameterValidator.RESPONSE_TYPE_CODE));
        metadata.put("grant_types_supported", ClientRegistry.GRANT_TYPES);
        metadata.put("code_challenge_methods_supported", List.of(PkceService.METHOD_S256));
        metadata.put("token_endpoint_auth_methods_supported", List.of(ClientRegistry.AUTH_METHOD_NONE));
        metadata.put("scopes_supported", validator.supportedScopes());
        return metadata;
    }

    @GET
    @Path("/oauth-protected-resource")
    @Operation(summary = "Protected resource metadata")
    public Map<String, Object> protectedResource() {
        String issuer = issuer();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resource", issuer);
        metadata.put("authorization_servers", List.of(issuer));
        metadata.put("scopes_supported", validator.supportedScopes());
        metadata.put("bearer_methods_supported", List.of("header"));
        return metadata;
    }

    private String issuer() {
        String base = authConfig.externalBaseUrl().orElseGet(() -> uriInfo.getBaseUri().toString());
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
