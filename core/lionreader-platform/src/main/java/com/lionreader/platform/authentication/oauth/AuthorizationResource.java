package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.CodeIssued;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.ConsentRequired;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.DirectError;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.LoginRequired;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.RedirectError;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OAuth 2.1 authorization endpoint (authorization code flow with PKCE).
 *
 * The flow itself lives in {@link AuthorizationFlow}; this resource only
 * reads the request and renders the outcome as a JSON error or a 302.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/draft-ietf-oauth-v2-1">OAuth 2.1</a>
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Tag(name = "OAuth Authorization", description = "OAuth 2.1 authorization code flow endpoints")
public class AuthorizationResource {

    @Inject
    AuthorizationFlow authorizationFlow;

    @Inject
    AuthConfig authConfig;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders httpHeaders;

    /**
     * GET /oauth/authorize?
     *   response_type=code
     *   &client_id=...
     *   &redirect_uri=https://client.example.com/callback
     *   &scope=mcp
     *   &state=xyz123
     *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
     *   &code_challenge_method=S256
     */
    @GET
    @Path("/authorize")
    @Operation(summary = "Start authorization code flow",
        description = "Redirects to the login page, the consent page, or back to the client with a code or error")
    @APIResponse(responseCode = "302", description = "Redirect to login, consent, or the client's redirect_uri")
    @APIResponse(responseCode = "400", description = "Invalid client_id or redirect_uri (never redirected)")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "Registered redirect URI, matched exactly")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Opaque client state, echoed back")
            @QueryParam("state") String state,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method, must be S256")
            @QueryParam("code_challenge_method") String codeChallengeMethod,

            @Parameter(description = "RFC 8707 resource indicator")
            @QueryParam("resource") String resource
    ) {
        AuthorizationRequest request = new AuthorizationRequest(responseType, clientId, redirectUri,
            scope, emptyToNull(state), codeChallenge, codeChallengeMethod, emptyToNull(resource));
        return render(authorizationFlow.authorize(request, sessionToken()));
    }

    /**
     * Consent form submission from the consent page.
     */
    @POST
    @Path("/authorize")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Submit consent decision")
    @APIResponse(responseCode = "302", description = "Redirect to the client with a code or error")
    @APIResponse(responseCode = "400", description = "Invalid client_id or redirect_uri (never redirected)")
    @APIResponse(responseCode = "401", description = "No valid session")
    public Response submitConsent(
            @FormParam("client_id") String clientId,
            @FormParam("redirect_uri") String redirectUri,
            @FormParam("scope") String scope,
            @FormParam("state") String state,
            @FormParam("code_challenge") String codeChallenge,
            @FormParam("code_challenge_method") String codeChallengeMethod,
            @FormParam("resource") String resource,
            @Parameter(description = "approve or deny")
            @FormParam("action") String action
    ) {
        ConsentDecision decision = new ConsentDecision(clientId, redirectUri, scope, emptyToNull(state),
            codeChallenge, emptyToNull(codeChallengeMethod), emptyToNull(resource), action);
        return render(authorizationFlow.submitConsent(decision, sessionToken()));
    }

    private Response render(AuthorizationOutcome outcome) {
        if (outcome instanceof DirectError error) {
            return Response.status(error.status())
                .entity(error.error().body(error.description()))
                .type(MediaType.APPLICATION_JSON)
                .build();
        }
        if (outcome instanceof RedirectError error) {
            StringBuilder url = new StringBuilder(error.redirectUri());
            url.append(error.redirectUri().contains("?") ? "&" : "?");
            url.append("error=").append(urlEncode(error.error().code()));
            url.append("&error_description=").append(urlEncode(error.description()));
            appendIfPresent(url, "state", error.state());
            return found(url.toString());
        }
        if (outcome instanceof LoginRequired) {
            String returnTo = uriInfo.getRequestUri().getRawPath();
            String query = uriInfo.getRequestUri().getRawQuery();
            if (query != null) {
                returnTo += "?" + query;
            }
            return found(appUrl(authConfig.session().loginPath()) + "?redirect=" + urlEncode(returnTo));
        }
        if (outcome instanceof ConsentRequired consent) {
            StringBuilder url = new StringBuilder(appUrl(authConfig.session().consentPath()));
            url.append("?client_id=").append(urlEncode(consent.client().clientId));
            url.append("&client_name=").append(urlEncode(consent.client().clientName));
            url.append("&redirect_uri=").append(urlEncode(consent.redirectUri()));
            url.append("&scope=").append(urlEncode(consent.scope()));
            url.append("&code_challenge=").append(urlEncode(consent.codeChallenge()));
            appendIfPresent(url, "state", consent.state());
            appendIfPresent(url, "resource", consent.resource());
            return found(url.toString());
        }
        CodeIssued issued = (CodeIssued) outcome;
        StringBuilder url = new StringBuilder(issued.redirectUri());
        url.append(issued.redirectUri().contains("?") ? "&" : "?");
        url.append("code=").append(urlEncode(issued.code()));
        appendIfPresent(url, "state", issued.state());
        return found(url.toString());
    }

    private String sessionToken() {
        Cookie cookie = httpHeaders.getCookies().get(authConfig.session().cookieName());
        return cookie == null ? null : cookie.getValue();
    }

    private String appUrl(String path) {
        return authConfig.externalBaseUrl()
            .map(base -> base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path)
            .orElse(path);
    }

    private static Response found(String location) {
        return Response.status(Response.Status.FOUND)
            .location(URI.create(location))
            .build();
    }

    private static void appendIfPresent(StringBuilder url, String name, String value) {
        if (value != null) {
            url.append('&').append(name).append('=').append(urlEncode(value));
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
