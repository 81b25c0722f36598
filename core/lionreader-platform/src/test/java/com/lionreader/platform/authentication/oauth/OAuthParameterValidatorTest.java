package com.lionreader.platform.authentication.oauth;

import com.lionreader.platform.authentication.AuthConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OAuthParameterValidator.
 */
class OAuthParameterValidatorTest {

    private OAuthParameterValidator validator;

    @BeforeEach
    void setUp() {
        AuthConfig authConfig = mock(AuthConfig.class, RETURNS_DEEP_STUBS);
        when(authConfig.oauth().supportedScopes()).thenReturn(List.of("mcp", "saved:write"));
        when(authConfig.oauth().defaultScope()).thenReturn("mcp");
        when(authConfig.oauth().nativeRedirectSchemes()).thenReturn(Optional.of(List.of("cursor")));

        validator = new OAuthParameterValidator();
        validator.authConfig = authConfig;
    }

    // ==================== Redirect URI format ====================

    @Test
    void isValidRedirectUriFormat_shouldAcceptHttpsLoopbackAndNativeSchemes() {
        assertThat(List.of(
            "https://app.example.com/callback",
            "https://app.example.com/callback?tenant=1",
            "http://localhost:3000/callback",
            "http://127.0.0.1/callback",
            "http://[::1]:8080/callback",
            "com.example.app:/oauth/callback",
            "cursor://anysphere.cursor-retrieval/oauth/callback"
        )).allMatch(validator::isValidRedirectUriFormat);
    }

    @Test
    void isValidRedirectUriFormat_shouldRejectUnsafeOrMalformedUris() {
        assertThat(List.of(
            "http://app.example.com/callback",
            "https://app.example.com/callback#fragment",
            "/callback",
            "javascript:alert(1)",
            "data:text/html,hello",
            "file:///etc/passwd",
            "myapp://callback",
            "com.example.app:callback",
            "not a uri",
            ""
        )).noneMatch(validator::isValidRedirectUriFormat);
        assertThat(validator.isValidRedirectUriFormat(null)).isFalse();
    }

    @Test
    void isValidRedirectUriFormat_shouldBoundLength() {
        String base = "https://app.example.com/";
        String longest = base + "a".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH - base.length());

        assertThat(validator.isValidRedirectUriFormat(longest)).isTrue();
        assertThat(validator.isValidRedirectUriFormat(longest + "a")).isFalse();
    }

    @Test
    void isValidState_shouldAcceptAbsentOrBoundedState() {
        assertThat(validator.isValidState(null)).isTrue();
        assertThat(validator.isValidState("s".repeat(600))).isTrue();
        assertThat(validator.isValidState("s".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH))).isTrue();
        assertThat(validator.isValidState("s".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH + 1))).isFalse();
    }

    @Test
    void isValidResource_shouldRejectOverlongIndicator() {
        String base = "https://lionreader.example.com/";
        assertThat(validator.isValidResource(base + "r".repeat(600))).isTrue();
        assertThat(validator.isValidResource(base + "r".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH))).isFalse();
    }

    @Test
    @DisplayName("Redirect URIs match exactly, without normalization")
    void validateRedirectUri_shouldRequireExactMatch() {
        List<String> registered = List.of("https://a.com/cb");

        assertThat(validator.validateRedirectUri("https://a.com/cb", registered)).isTrue();
        assertThat(validator.validateRedirectUri("https://a.com/cb/", registered)).isFalse();
        assertThat(validator.validateRedirectUri("https://A.com/cb", registered)).isFalse();
        assertThat(validator.validateRedirectUri("https://a.com/cb?x=1", registered)).isFalse();
        assertThat(validator.validateRedirectUri("https://a.com/c", registered)).isFalse();
        assertThat(validator.validateRedirectUri("https://a.com:8443/cb", registered)).isFalse();
        assertThat(validator.validateRedirectUri("https://a.com:443/cb", registered)).isFalse();
        assertThat(validator.validateRedirectUri(null, registered)).isFalse();
    }

    // ==================== Scopes ====================

    @Test
    void parseScopes_shouldSplitOnWhitespaceAndDropDuplicates() {
        assertThat(validator.parseScopes("mcp saved:write")).containsExactly("mcp", "saved:write");
        assertThat(validator.parseScopes("  saved:write\tmcp   saved:write ")).containsExactly("saved:write", "mcp");
    }

    @Test
    void parseScopes_shouldDefaultWhenMissing() {
        assertThat(validator.parseScopes(null)).containsExactly("mcp");
        assertThat(validator.parseScopes("")).containsExactly("mcp");
        assertThat(validator.parseScopes("   ")).containsExactly("mcp");
    }

    @Test
    void validateScopes_shouldReturnIntersectionInRequestOrder() {
        List<String> granted = validator.validateScopes(
            List.of("saved:write", "admin", "mcp"), List.of("mcp", "saved:write"));

        assertThat(granted).containsExactly("saved:write", "mcp");
    }

    @Test
    void validateScopes_shouldReturnEmptyWhenDisjoint() {
        assertThat(validator.validateScopes(List.of("admin"), List.of("mcp"))).isEmpty();
        assertThat(validator.validateScopes(List.of("saved:write"), List.of("mcp"))).isEmpty();
    }

    @Test
    void validateScopes_shouldDropScopesTheServerDoesNotSupport() {
        assertThat(validator.validateScopes(List.of("legacy", "mcp"), List.of("legacy", "mcp")))
            .containsExactly("mcp");
    }

    // ==================== Other parameters ====================

    @Test
    void isSupportedResponseType_shouldAcceptOnlyCode() {
        assertThat(validator.isSupportedResponseType("code")).isTrue();
        assertThat(validator.isSupportedResponseType("token")).isFalse();
        assertThat(validator.isSupportedResponseType("code id_token")).isFalse();
        assertThat(validator.isSupportedResponseType(null)).isFalse();
    }

    @Test
    void isValidResource_shouldRequireAbsoluteUriWithoutFragment() {
        assertThat(validator.isValidResource(null)).isTrue();
        assertThat(validator.isValidResource("https://lionreader.example.com/mcp")).isTrue();
        assertThat(validator.isValidResource("/mcp")).isFalse();
        assertThat(validator.isValidResource("https://lionreader.example.com/mcp#x")).isFalse();
    }
}
