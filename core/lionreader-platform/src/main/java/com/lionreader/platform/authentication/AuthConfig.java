package com.lionreader.platform.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the Lion Reader authorization server.
 *
 * Example configuration:
 * <pre>
 * lionreader.auth.external-base-url=https://lionreader.example.com
 * lionreader.auth.oauth.access-token-expiry=PT1H
 * lionreader.auth.oauth.supported-scopes=mcp,saved:write
 * lionreader.auth.session.cookie-name=session
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "lionreader.auth")
public interface AuthConfig {

    /**
     * Public base URL of the application, used as the OAuth issuer and
     * for absolute URLs in discovery metadata and login/consent redirects.
     * In dev: http://localhost:8080
     * In prod: https://lionreader.example.com
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * OAuth 2.1 token and scope configuration.
     */
    OAuthConfig oauth();

    /**
     * Browser session configuration (owned by the login system).
     */
    SessionConfig session();

    interface OAuthConfig {
        /**
         * Access token lifetime.
         * Default: 1 hour
         */
        @WithName("access-token-expiry")
        @WithDefault("PT1H")
        Duration accessTokenExpiry();

        /**
         * Refresh token lifetime.
         * Default: 30 days
         */
        @WithName("refresh-token-expiry")
        @WithDefault("P30D")
        Duration refreshTokenExpiry();

        /**
         * Authorization code lifetime. Values above 10 minutes are capped.
         * Default: 10 minutes
         */
        @WithName("authorization-code-expiry")
        @WithDefault("PT10M")
        Duration authorizationCodeExpiry();

        /**
         * Scopes this server can grant.
         */
        @WithName("supported-scopes")
        @WithDefault("mcp,saved:write")
        List<String> supportedScopes();

        /**
         * Scope used when a request or registration names none.
         */
        @WithName("default-scope")
        @WithDefault("mcp")
        String defaultScope();

        /**
         * Extra custom URI schemes accepted as native-app redirect URIs,
         * in addition to reverse-domain private-use schemes.
         */
        @WithName("native-redirect-schemes")
        Optional<List<String>> nativeRedirectSchemes();

        /**
         * How long expired or used rows are kept before the janitor deletes them.
         * Default: 1 day
         */
        @WithName("janitor-retention")
        @WithDefault("P1D")
        Duration janitorRetention();

        /**
         * How often the janitor runs ("off" disables it).
         * Default: 1h
         */
        @WithName("janitor-interval")
        @WithDefault("1h")
        String janitorInterval();
    }

    interface SessionConfig {
        /**
         * Cookie carrying the browser session token.
         */
        @WithName("cookie-name")
        @WithDefault("session")
        String cookieName();

        /**
         * Login page; receives the original authorize URL in the "redirect" parameter.
         */
        @WithName("login-path")
        @WithDefault("/login")
        String loginPath();

        /**
         * Consent page that renders the approve/deny form and posts back to /oauth/authorize.
         */
        @WithName("consent-path")
        @WithDefault("/oauth/consent")
        String consentPath();
    }
}
