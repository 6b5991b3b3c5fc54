package com.clinical.icdlookup.service.auth;

/**
 * OAuth2 client credentials for the registry token endpoint.
 *
 * @param clientId     client id
 * @param clientSecret client secret
 * @param scope        requested scope
 */
public record RegistryCredentials(String clientId, String clientSecret, String scope) {

    @Override
    public String toString() {
        return "RegistryCredentials[clientId=" + clientId + ", scope=" + scope + "]";
    }
}
