package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.SecureTokens;
import com.lionreader.platform.authentication.SessionValidator;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.CodeIssued;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.ConsentRequired;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.DirectError;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.LoginRequired;
import com.lionreader.platform.authentication.oauth.AuthorizationOutcome.RedirectError;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Authorization endpoint logic: START -> VALIDATED -> AUTHENTICATED -> CONSENTED -> CODE_ISSUED.
 *
 * Until the client and redirect URI are verified, errors are returned
 * directly and never redirected, so an attacker cannot bounce the user to
 * an arbitrary URL. After verification, errors go to the client's redirect URI
 * with the original state.
 */
@ApplicationScoped
public class AuthorizationFlow {

    private static final Logger LOG = Logger.getLogger(AuthorizationFlow.class);

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    OAuthParameterValidator validator;

    @Inject
    PkceService pkceService;

    @Inject
    SessionValidator sessionValidator;

    @Inject
    ConsentLedger consentLedger;

    @Inject
    AuthorizationCodeStore codeStore;

    /**
     * GET /oauth/authorize.
     */
    @Transactional
    public AuthorizationOutcome authorize(AuthorizationRequest request, String sessionToken) {
        // START -> VALIDATED
        DirectError untrusted = checkClientAndRedirect(request.clientId(), request.redirectUri());
        if (untrusted != null) {
            return untrusted;
        }
        OAuthClient client = clientRegistry.resolveClient(request.clientId()).orElseThrow();
        String redirectUri = request.redirectUri();
        String state = request.state();

        if (!validator.isSupportedResponseType(request.responseType())) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.UNSUPPORTED_RESPONSE_TYPE,
                "Only response_type=code is supported", state);
        }
        RedirectError invalid = checkRequestParameters(redirectUri,
            request.codeChallenge(), request.codeChallengeMethod(), request.resource(), state);
        if (invalid != null) {
            return invalid;
        }
        List<String> scopes = validator.validateScopes(validator.parseScopes(request.scope()), client.scopes);
        if (scopes.isEmpty()) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_SCOPE,
                "No valid scopes requested", state);
        }

        // VALIDATED -> AUTHENTICATED
        Optional<String> userId = sessionValidator.validateSession(sessionToken);
        if (userId.isEmpty()) {
            LOG.debugf("No session for authorization request of client %s", SecureTokens.truncate(client.clientId));
            return new LoginRequired();
        }

        // AUTHENTICATED -> CONSENTED
        if (!consentLedger.hasConsent(userId.get(), client.clientId, scopes)) {
            return new ConsentRequired(client, redirectUri, scopes, request.codeChallenge(), state, request.resource());
        }

        // CONSENTED -> CODE_ISSUED
        return issueCode(client, userId.get(), redirectUri, scopes, request.codeChallenge(), request.resource(), state);
    }

    /**
     * POST /oauth/authorize. Re-validates everything the consent page echoed back.
     */
    @Transactional
    public AuthorizationOutcome submitConsent(ConsentDecision decision, String sessionToken) {
        DirectError untrusted = checkClientAndRedirect(decision.clientId(), decision.redirectUri());
        if (untrusted != null) {
            return untrusted;
        }
        OAuthClient client = clientRegistry.resolveClient(decision.clientId()).orElseThrow();
        String redirectUri = decision.redirectUri();
        String state = decision.state();

        // the consent page echoes only the already-validated S256 challenge
        String method = decision.codeChallengeMethod() == null ? PkceService.METHOD_S256 : decision.codeChallengeMethod();
        RedirectError invalid = checkRequestParameters(redirectUri,
            decision.codeChallenge(), method, decision.resource(), state);
        if (invalid != null) {
            return invalid;
        }
        List<String> scopes = validator.validateScopes(validator.parseScopes(decision.scope()), client.scopes);
        if (scopes.isEmpty()) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_SCOPE,
                "No valid scopes requested", state);
        }

        Optional<String> userId = sessionValidator.validateSession(sessionToken);
        if (userId.isEmpty()) {
            return new DirectError(401, OAuthError.ACCESS_DENIED, "Not authenticated");
        }

        if (ConsentDecision.DENY.equals(decision.action())) {
            LOG.infof("User %s denied client %s", SecureTokens.truncate(userId.get()),
                SecureTokens.truncate(client.clientId));
            return redirectError(AuthorizationStage.AUTHENTICATED, redirectUri, OAuthError.ACCESS_DENIED,
                "The user denied the request", state);
        }
        if (!ConsentDecision.APPROVE.equals(decision.action())) {
            return redirectError(AuthorizationStage.AUTHENTICATED, redirectUri, OAuthError.INVALID_REQUEST,
                "action must be approve or deny", state);
        }

        consentLedger.recordConsent(userId.get(), client.clientId, scopes);
        return issueCode(client, userId.get(), redirectUri, scopes, decision.codeChallenge(), decision.resource(), state);
    }

    /**
     * @return null when the client exists and the redirect URI is registered for it
     */
    private DirectError checkClientAndRedirect(String clientId, String redirectUri) {
        if (clientId == null || clientId.isBlank()) {
            return new DirectError(400, OAuthError.INVALID_REQUEST, "Missing client_id parameter");
        }
        if (redirectUri == null || redirectUri.isBlank()) {
            return new DirectError(400, OAuthError.INVALID_REQUEST, "Missing redirect_uri parameter");
        }
        if (!validator.isValidRedirectUriFormat(redirectUri)) {
            return new DirectError(400, OAuthError.INVALID_REQUEST, "Invalid redirect_uri format");
        }
        Optional<OAuthClient> client = clientRegistry.resolveClient(clientId);
        if (client.isEmpty()) {
            LOG.debugf("Authorization request for unknown client %s", SecureTokens.truncate(clientId));
            return new DirectError(400, OAuthError.INVALID_CLIENT, "Unknown client_id");
        }
        if (!validator.validateRedirectUri(redirectUri, client.get().redirectUris)) {
            LOG.warnf("Unregistered redirect_uri for client %s", SecureTokens.truncate(clientId));
            return new DirectError(400, OAuthError.INVALID_REQUEST, "redirect_uri is not registered for this client");
        }
        return null;
    }

    /**
     * PKCE, resource and state checks, once errors can be redirected.
     *
     * @return null when valid
     */
    private RedirectError checkRequestParameters(String redirectUri, String codeChallenge,
                                                 String codeChallengeMethod, String resource, String state) {
        if (codeChallenge == null || codeChallenge.isEmpty()) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_REQUEST,
                "code_challenge is required", state);
        }
        if (!pkceService.isSupportedMethod(codeChallengeMethod)) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_REQUEST,
                "code_challenge_method must be S256", state);
        }
        if (!pkceService.isValidCodeChallenge(codeChallenge)) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_REQUEST,
                "Invalid code_challenge format", state);
        }
        if (!validator.isValidResource(resource)) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_REQUEST,
                "resource must be an absolute URI without fragment", state);
        }
        if (!validator.isValidState(state)) {
            return redirectError(AuthorizationStage.VALIDATED, redirectUri, OAuthError.INVALID_REQUEST,
                "state must be at most " + OAuthParameterValidator.MAX_PARAMETER_LENGTH + " characters", state);
        }
        return null;
    }

    private CodeIssued issueCode(OAuthClient client, String userId, String redirectUri, List<String> scopes,
                                 String codeChallenge, String resource, String state) {
        String code = codeStore.issue(client.clientId, userId, redirectUri, scopes, codeChallenge, resource, state);
        LOG.infof("Issued authorization code to client %s for user %s",
            SecureTokens.truncate(client.clientId), SecureTokens.truncate(userId));
        return new CodeIssued(redirectUri, code, state);
    }

    private static RedirectError redirectError(AuthorizationStage stage, String redirectUri, OAuthError error,
                                               String description, String state) {
        return new RedirectError(stage, redirectUri, error, description, state);
    }
}
