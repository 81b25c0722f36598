package com.lionreader.platform.authentication.oauth;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.lionreader.platform.authentication.oauth.OAuthTestFixtures.REDIRECT_URI;
import static com.lionreader.platform.authentication.oauth.OAuthTestFixtures.queryParam;
import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the authorization endpoint (GET and POST /oauth/authorize).
 */
@Tag("integration")
@QuarkusTest
class AuthorizationResourceTest {

    private static final String BASE_URL = "http://localhost:8081";

    @Inject
    OAuthTestFixtures fixtures;

    @Inject
    PkceService pkceService;

    @Inject
    ConsentLedger consentLedger;

    private OAuthClient client;
    private String userId;
    private String session;
    private String challenge;

    @BeforeEach
    void setUp() {
        client = fixtures.registerClient();
        userId = OAuthTestFixtures.uniqueUserId();
        session = fixtures.createSession(userId);
        challenge = pkceService.computeCodeChallenge(OAuthTestFixtures.codeVerifier());
    }

    /**
     * A valid authorization request; each override replaces one parameter.
     */
    private RequestSpecification authorizeRequest(String... overrides) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", client.clientId);
        params.put("redirect_uri", REDIRECT_URI);
        params.put("scope", "mcp");
        params.put("state", "xyz 123");
        params.put("code_challenge", challenge);
        params.put("code_challenge_method", "S256");
        applyOverrides(params, overrides);
        return given()
            .redirects().follow(false)
            .queryParams(params);
    }

    private RequestSpecification consentForm(String action, String... overrides) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", client.clientId);
        params.put("redirect_uri", REDIRECT_URI);
        params.put("scope", "mcp");
        params.put("state", "xyz 123");
        params.put("code_challenge", challenge);
        params.put("action", action);
        applyOverrides(params, overrides);
        return given()
            .redirects().follow(false)
            .cookie("session", session)
            .formParams(params);
    }

    private static void applyOverrides(Map<String, String> params, String... overrides) {
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            params.put(overrides[i], overrides[i + 1]);
        }
    }

    // ==================== GET /oauth/authorize ====================

    @Test
    @DisplayName("Authorize without a session should redirect to login with a return URL")
    void authorize_shouldRedirectToLogin_whenNotAuthenticated() {
        Response response = authorizeRequest()
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(location).startsWith(BASE_URL + "/login?redirect=");
        assertThat(queryParam(location, "redirect"))
            .startsWith("/oauth/authorize?")
            .contains("client_id=" + client.clientId);
    }

    @Test
    @DisplayName("Authorize with a session but no consent should redirect to the consent page")
    void authorize_shouldRedirectToConsent_whenNoConsent() {
        Response response = authorizeRequest()
            .cookie("session", session)
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(location).startsWith(BASE_URL + "/oauth/consent?");
        assertThat(queryParam(location, "client_id")).isEqualTo(client.clientId);
        assertThat(queryParam(location, "client_name")).isEqualTo(client.clientName);
        assertThat(queryParam(location, "redirect_uri")).isEqualTo(REDIRECT_URI);
        assertThat(queryParam(location, "scope")).isEqualTo("mcp");
        assertThat(queryParam(location, "code_challenge")).isEqualTo(challenge);
        assertThat(queryParam(location, "state")).isEqualTo("xyz 123");
    }

    @Test
    @DisplayName("Authorize with existing consent should redirect straight back with a code")
    void authorize_shouldIssueCode_whenConsentExists() {
        consentLedger.recordConsent(userId, client.clientId, List.of("mcp"));

        Response response = authorizeRequest()
            .cookie("session", session)
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(location).startsWith(REDIRECT_URI + "?code=");
        assertThat(queryParam(location, "code")).isNotBlank();
        assertThat(queryParam(location, "state")).isEqualTo("xyz 123");
    }

    @Test
    @DisplayName("Authorize with an unregistered redirect URI should return 400 without redirecting")
    void authorize_shouldReturn400_forUnregisteredRedirectUri() {
        authorizeRequest("redirect_uri", "https://attacker.example.com/callback")
            .cookie("session", session)
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(400)
            .header("Location", nullValue())
            .body("error", equalTo("invalid_request"));
    }

    @Test
    @DisplayName("Authorize with an unknown client should return 400 without redirecting")
    void authorize_shouldReturn400_forUnknownClient() {
        authorizeRequest("client_id", "unknown-client")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(400)
            .header("Location", nullValue())
            .body("error", equalTo("invalid_client"));
    }

    @Test
    @DisplayName("Authorize without a code challenge should redirect back with invalid_request")
    void authorize_shouldRedirectError_whenChallengeMissing() {
        Response response = given()
            .redirects().follow(false)
            .queryParam("response_type", "code")
            .queryParam("client_id", client.clientId)
            .queryParam("redirect_uri", REDIRECT_URI)
            .queryParam("state", "s1")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(location).startsWith(REDIRECT_URI + "?");
        assertThat(queryParam(location, "error")).isEqualTo("invalid_request");
        assertThat(queryParam(location, "error_description")).isNotBlank();
        assertThat(queryParam(location, "state")).isEqualTo("s1");
    }

    @Test
    @DisplayName("Authorize with the plain challenge method should redirect back with invalid_request")
    void authorize_shouldRedirectError_forPlainMethod() {
        Response response = authorizeRequest("code_challenge_method", "plain")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        assertThat(queryParam(response.getHeader("Location"), "error")).isEqualTo("invalid_request");
    }

    @Test
    @DisplayName("Authorize with another response type should redirect back with unsupported_response_type")
    void authorize_shouldRedirectError_forTokenResponseType() {
        Response response = authorizeRequest("response_type", "token")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        assertThat(queryParam(response.getHeader("Location"), "error")).isEqualTo("unsupported_response_type");
    }

    @Test
    @DisplayName("Authorize with only unsupported scopes should redirect back with invalid_scope")
    void authorize_shouldRedirectError_forInvalidScope() {
        Response response = authorizeRequest("scope", "admin")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "error")).isEqualTo("invalid_scope");
        assertThat(queryParam(location, "state")).isEqualTo("xyz 123");
    }

    @Test
    @DisplayName("An empty state should not be echoed back")
    void authorize_shouldOmitEmptyState() {
        Response response = authorizeRequest("state", "", "scope", "admin")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "error")).isEqualTo("invalid_scope");
        assertThat(location).doesNotContain("state=");
    }

    @Test
    @DisplayName("An overlong state should redirect back with invalid_request")
    void authorize_shouldRedirectError_forOverlongState() {
        String state = "s".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH + 1);

        Response response = authorizeRequest("state", state)
            .cookie("session", session)
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(location).startsWith(REDIRECT_URI + "?");
        assertThat(queryParam(location, "error")).isEqualTo("invalid_request");
        assertThat(queryParam(location, "state")).isEqualTo(state);
    }

    // ==================== POST /oauth/authorize ====================

    @Test
    @DisplayName("Approving with a long state should still issue a code and echo the state")
    void submitConsent_shouldIssueCode_withLongState() {
        String state = "s".repeat(600);

        Response response = consentForm("approve", "state", state)
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "code")).isNotBlank();
        assertThat(queryParam(location, "state")).isEqualTo(state);
    }

    @Test
    @DisplayName("Approving with an overlong state should redirect back with invalid_request")
    void submitConsent_shouldRedirectError_forOverlongState() {
        String state = "s".repeat(OAuthParameterValidator.MAX_PARAMETER_LENGTH + 1);

        Response response = consentForm("approve", "state", state)
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "error")).isEqualTo("invalid_request");
        assertThat(queryParam(location, "code")).isNull();
        assertThat(consentLedger.hasConsent(userId, client.clientId, List.of("mcp"))).isFalse();
    }

    @Test
    @DisplayName("Approving consent should redirect back with a code and remember the grant")
    void submitConsent_shouldIssueCode_onApprove() {
        Response response = consentForm("approve")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "code")).isNotBlank();
        assertThat(queryParam(location, "state")).isEqualTo("xyz 123");
        assertThat(consentLedger.hasConsent(userId, client.clientId, List.of("mcp"))).isTrue();
    }

    @Test
    @DisplayName("Denying consent should redirect back with access_denied")
    void submitConsent_shouldRedirectAccessDenied_onDeny() {
        Response response = consentForm("deny")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        String location = response.getHeader("Location");
        assertThat(queryParam(location, "error")).isEqualTo("access_denied");
        assertThat(queryParam(location, "code")).isNull();
        assertThat(queryParam(location, "state")).isEqualTo("xyz 123");
        assertThat(consentLedger.hasConsent(userId, client.clientId, List.of("mcp"))).isFalse();
    }

    @Test
    @DisplayName("Submitting consent without a session should return 401")
    void submitConsent_shouldReturn401_whenNotAuthenticated() {
        given()
            .redirects().follow(false)
            .formParam("client_id", client.clientId)
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("scope", "mcp")
            .formParam("code_challenge", challenge)
            .formParam("action", "approve")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(401)
            .body("error", equalTo("access_denied"));
    }

    @Test
    @DisplayName("Submitting consent with a tampered redirect URI should return 400 without redirecting")
    void submitConsent_shouldReturn400_forTamperedRedirectUri() {
        consentForm("approve", "redirect_uri", "https://attacker.example.com/callback")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(400)
            .header("Location", nullValue());
    }
}
