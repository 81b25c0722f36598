package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Authenticates {@link BearerTokenRequired} resources with an OAuth access token.
 *
 * Missing or invalid tokens get 401 with a WWW-Authenticate challenge that
 * points MCP clients at the protected resource metadata (RFC 9728 Section 5.1).
 */
@Provider
@BearerTokenRequired
@Priority(Priorities.AUTHENTICATION)
public class BearerTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(BearerTokenFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    BearerTokenContext bearerTokenContext;

    @Inject
    AuthConfig authConfig;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String header = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            abort(requestContext, "Missing bearer token");
            return;
        }

        String token = header.substring(BEARER_PREFIX.length()).trim();
        Optional<AccessTokenInfo> info = tokenIssuer.validateAccessToken(token);
        if (info.isEmpty()) {
            LOG.debugf("Rejected bearer token on %s", requestContext.getUriInfo().getPath());
            abort(requestContext, "Invalid or expired access token");
            return;
        }
        bearerTokenContext.authenticate(info.get());
    }

    private void abort(ContainerRequestContext requestContext, String description) {
        String base = authConfig.externalBaseUrl()
            .orElseGet(() -> requestContext.getUriInfo().getBaseUri().toString());
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String challenge = "Bearer error=\"invalid_token\", error_description=\"" + description
            + "\", resource_metadata=\"" + base + "/.well-known/oauth-protected-resource\"";
        requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, challenge)
            .entity(OAuthError.INVALID_TOKEN.body(description))
            .type(MediaType.APPLICATION_JSON)
            .build());
    }
}
