package com.lionreader.platform.authentication.oauth;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the discovery documents.
 */
@Tag("integration")
@QuarkusTest
class OAuthMetadataResourceTest {

    private static final String ISSUER = "http://localhost:8081";

    @Test
    void authorizationServerMetadata_shouldAdvertiseEndpoints() {
        given()
        .when()
            .get("/.well-known/oauth-authorization-server")
        .then()
            .statusCode(200)
            .body("issuer", equalTo(ISSUER))
            .body("authorization_endpoint", equalTo(ISSUER + "/oauth/authorize"))
            .body("token_endpoint", equalTo(ISSUER + "/oauth/token"))
            .body("registration_endpoint", equalTo(ISSUER + "/oauth/register"))
            .body("response_types_supported", contains("code"))
            .body("grant_types_supported", contains("authorization_code", "refresh_token"))
            .body("code_challenge_methods_supported", contains("S256"))
            .body("token_endpoint_auth_methods_supported", contains("none"))
            .body("scopes_supported", hasItems("mcp", "saved:write"));
    }

    @Test
    void protectedResourceMetadata_shouldPointAtIssuer() {
        given()
        .when()
            .get("/.well-known/oauth-protected-resource")
        .then()
            .statusCode(200)
            .body("resource", equalTo(ISSUER))
            .body("authorization_servers", contains(ISSUER))
            .body("bearer_methods_supported", contains("header"));
    }
}
