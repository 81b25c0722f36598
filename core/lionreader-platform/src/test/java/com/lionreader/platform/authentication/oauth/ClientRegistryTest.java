package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.common.Result;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for ClientRegistry.
 */
@Tag("integration")
@QuarkusTest
class ClientRegistryTest {

    @Inject
    ClientRegistry clientRegistry;

    private Result<OAuthClient> register(String name, List<String> redirectUris, String scope) {
        return clientRegistry.registerClient(new ClientRegistrationRequest(name, redirectUris, scope, null, null, null));
    }

    private String errorCode(Result<OAuthClient> result) {
        assertThat(result).isInstanceOf(Result.Failure.class);
        return ((Result.Failure<OAuthClient>) result).error().code();
    }

    @Test
    void registerClient_shouldPersistAndResolve() {
        Result<OAuthClient> result = register("Claude Desktop",
            List.of("http://127.0.0.1:33418/callback", "https://claude.ai/api/mcp/auth_callback"), null);

        assertThat(result.isSuccess()).isTrue();
        OAuthClient client = ((Result.Success<OAuthClient>) result).value();
        assertThat(client.clientId).isNotBlank();
        assertThat(client.scopes).containsExactly("mcp");

        OAuthClient resolved = clientRegistry.resolveClient(client.clientId).orElseThrow();
        assertThat(resolved.clientName).isEqualTo("Claude Desktop");
        assertThat(resolved.redirectUris).containsExactly(
            "http://127.0.0.1:33418/callback", "https://claude.ai/api/mcp/auth_callback");
    }

    @Test
    void registerClient_shouldGenerateUniqueClientIds() {
        OAuthClient a = ((Result.Success<OAuthClient>) register("A", List.of("https://a.example.com/cb"), null)).value();
        OAuthClient b = ((Result.Success<OAuthClient>) register("B", List.of("https://a.example.com/cb"), null)).value();

        assertThat(a.clientId).isNotEqualTo(b.clientId);
    }

    @Test
    void registerClient_shouldKeepRequestedSupportedScopes() {
        OAuthClient client = ((Result.Success<OAuthClient>) register("Saver",
            List.of("https://a.example.com/cb"), "saved:write mcp")).value();

        assertThat(client.scopes).containsExactly("saved:write", "mcp");
    }

    @Test
    void registerClient_shouldRejectMissingName() {
        assertThat(errorCode(register(" ", List.of("https://a.example.com/cb"), null)))
            .isEqualTo("invalid_client_metadata");
    }

    @Test
    void registerClient_shouldRejectMissingOrInvalidRedirectUris() {
        assertThat(errorCode(register("X", List.of(), null))).isEqualTo("invalid_redirect_uri");
        assertThat(errorCode(register("X", null, null))).isEqualTo("invalid_redirect_uri");
        assertThat(errorCode(register("X", List.of("http://evil.example.com/cb"), null))).isEqualTo("invalid_redirect_uri");
        assertThat(errorCode(register("X", List.of("https://a.example.com/cb#frag"), null))).isEqualTo("invalid_redirect_uri");
    }

    @Test
    void registerClient_shouldRejectUnsupportedScope() {
        assertThat(errorCode(register("X", List.of("https://a.example.com/cb"), "mcp admin")))
            .isEqualTo("invalid_client_metadata");
    }

    @Test
    void registerClient_shouldRejectConfidentialClients() {
        Result<OAuthClient> result = clientRegistry.registerClient(new ClientRegistrationRequest(
            "X", List.of("https://a.example.com/cb"), null, null, null, "client_secret_basic"));

        assertThat(errorCode(result)).isEqualTo("invalid_client_metadata");
    }

    @Test
    void resolveClient_shouldReturnEmpty_forUnknownOrBlankId() {
        assertThat(clientRegistry.resolveClient("does-not-exist")).isEmpty();
        assertThat(clientRegistry.resolveClient("")).isEmpty();
        assertThat(clientRegistry.resolveClient(null)).isEmpty();
    }
}
