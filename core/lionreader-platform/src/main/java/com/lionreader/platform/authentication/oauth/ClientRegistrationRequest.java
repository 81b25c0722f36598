package com.lionreader.platform.authentication.oauth;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dynamic client registration metadata (RFC 7591 Section 2).
 * Unknown members are ignored.
 */
public record ClientRegistrationRequest(
    @JsonProperty("client_name") String clientName,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("scope") String scope,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod
) {
}
