package com.clinical.icdlookup.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the OAuth2 token endpoint.
 *
 * @param accessToken bearer token
 * @param expiresIn   declared lifetime in seconds
 * @param tokenType   normally {@code Bearer}
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("token_type") String tokenType
) {
}
