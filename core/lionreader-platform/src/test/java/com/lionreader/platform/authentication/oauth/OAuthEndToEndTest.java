package com.lionreader.platform.authentication.oauth;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static com.lionreader.platform.authentication.oauth.OAuthTestFixtures.queryParam;
import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.*;

/**
 * Full MCP client journey: register, authorize, consent, exchange, call, refresh.
 */
@Tag("integration")
@QuarkusTest
class OAuthEndToEndTest {

    private static final String REDIRECT_URI = "http://127.0.0.1:33418/callback";
    private static final String RESOURCE = "https://lionreader.example.com/mcp";

    @Inject
    OAuthTestFixtures fixtures;

    @Inject
    PkceService pkceService;

    @Test
    @DisplayName("A registered client should complete the flow and rotate its refresh token")
    void fullFlow_shouldIssueUsableAndRotatingTokens() {
        String clientId = given()
            .contentType(ContentType.JSON)
            .body("""
                {"client_name": "MCP Inspector", "redirect_uris": ["%s"], "scope": "mcp saved:write"}
                """.formatted(REDIRECT_URI))
        .when()
            .post("/oauth/register")
        .then()
            .statusCode(201)
            .extract().path("client_id");

        String userId = OAuthTestFixtures.uniqueUserId();
        String session = fixtures.createSession(userId);
        String verifier = OAuthTestFixtures.codeVerifier();
        String challenge = pkceService.computeCodeChallenge(verifier);

        // first visit lands on the consent page
        Response consentRedirect = given()
            .redirects().follow(false)
            .cookie("session", session)
            .queryParam("response_type", "code")
            .queryParam("client_id", clientId)
            .queryParam("redirect_uri", REDIRECT_URI)
            .queryParam("scope", "mcp saved:write")
            .queryParam("state", "af0ifjsldkj")
            .queryParam("code_challenge", challenge)
            .queryParam("code_challenge_method", "S256")
            .queryParam("resource", RESOURCE)
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();
        String consentPage = consentRedirect.getHeader("Location");
        assertThat(queryParam(consentPage, "resource")).isEqualTo(RESOURCE);

        // the consent page posts back what it was given
        Response approved = given()
            .redirects().follow(false)
            .cookie("session", session)
            .formParam("client_id", queryParam(consentPage, "client_id"))
            .formParam("redirect_uri", queryParam(consentPage, "redirect_uri"))
            .formParam("scope", queryParam(consentPage, "scope"))
            .formParam("state", queryParam(consentPage, "state"))
            .formParam("code_challenge", queryParam(consentPage, "code_challenge"))
            .formParam("resource", queryParam(consentPage, "resource"))
            .formParam("action", "approve")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();
        String callback = approved.getHeader("Location");
        assertThat(callback).startsWith(REDIRECT_URI + "?");
        assertThat(queryParam(callback, "state")).isEqualTo("af0ifjsldkj");
        String code = queryParam(callback, "code");

        Response tokens = given()
            .formParam("grant_type", "authorization_code")
            .formParam("code", code)
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("client_id", clientId)
            .formParam("code_verifier", verifier)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(200)
            .body("token_type", equalTo("bearer"))
            .body("scope", equalTo("mcp saved:write"))
            .extract().response();
        String accessToken = tokens.path("access_token");
        String refreshToken = tokens.path("refresh_token");

        given()
            .header("Authorization", "Bearer " + accessToken)
        .when()
            .get("/oauth/tokeninfo")
        .then()
            .statusCode(200)
            .body("user_id", equalTo(userId))
            .body("client_id", equalTo(clientId))
            .body("scope", equalTo("mcp saved:write"))
            .body("resource", equalTo(RESOURCE));

        // codes are single use
        given()
            .formParam("grant_type", "authorization_code")
            .formParam("code", code)
            .formParam("redirect_uri", REDIRECT_URI)
            .formParam("client_id", clientId)
            .formParam("code_verifier", verifier)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));

        String rotated = given()
            .formParam("grant_type", "refresh_token")
            .formParam("refresh_token", refreshToken)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(200)
            .extract().path("refresh_token");
        assertThat(rotated).isNotEqualTo(refreshToken);

        // replaying the old refresh token revokes the whole family
        given()
            .formParam("grant_type", "refresh_token")
            .formParam("refresh_token", refreshToken)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));

        given()
            .formParam("grant_type", "refresh_token")
            .formParam("refresh_token", rotated)
            .formParam("client_id", clientId)
        .when()
            .post("/oauth/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));

        given()
            .header("Authorization", "Bearer " + accessToken)
        .when()
            .get("/oauth/tokeninfo")
        .then()
            .statusCode(401);
    }

    @Test
    @DisplayName("A second authorization after consent should skip the consent page")
    void secondAuthorization_shouldSkipConsent() {
        OAuthClient client = fixtures.registerClient("mcp");
        String session = fixtures.createSession(OAuthTestFixtures.uniqueUserId());
        String challenge = pkceService.computeCodeChallenge(OAuthTestFixtures.codeVerifier());

        given()
            .redirects().follow(false)
            .cookie("session", session)
            .formParam("client_id", client.clientId)
            .formParam("redirect_uri", OAuthTestFixtures.REDIRECT_URI)
            .formParam("scope", "mcp")
            .formParam("code_challenge", challenge)
            .formParam("action", "approve")
        .when()
            .post("/oauth/authorize")
        .then()
            .statusCode(302);

        Response response = given()
            .redirects().follow(false)
            .cookie("session", session)
            .queryParam("response_type", "code")
            .queryParam("client_id", client.clientId)
            .queryParam("redirect_uri", OAuthTestFixtures.REDIRECT_URI)
            .queryParam("code_challenge", challenge)
            .queryParam("code_challenge_method", "S256")
        .when()
            .get("/oauth/authorize")
        .then()
            .statusCode(302)
            .extract().response();

        assertThat(queryParam(response.getHeader("Location"), "code")).isNotBlank();
    }

    @Test
    @DisplayName("Protected endpoints should challenge callers without a valid token")
    void tokenInfo_shouldReturn401WithChallenge_whenTokenMissingOrInvalid() {
        given()
        .when()
            .get("/oauth/tokeninfo")
        .then()
            .statusCode(401)
            .header("WWW-Authenticate", startsWith("Bearer error=\"invalid_token\""))
            .header("WWW-Authenticate",
                containsString("resource_metadata=\"http://localhost:8081/.well-known/oauth-protected-resource\""))
            .body("error", equalTo("invalid_token"));

        given()
            .header("Authorization", "Bearer not-a-real-token")
        .when()
            .get("/oauth/tokeninfo")
        .then()
            .statusCode(401)
            .body("error", equalTo("invalid_token"));
    }
}
