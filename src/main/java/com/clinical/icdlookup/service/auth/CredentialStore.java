package com.clinical.icdlookup.service.auth;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.error.RegistryConfigException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Reads the registry client credentials from local configuration.
 * <p>
 * The values normally come from the untracked {@code .env} file
 * ({@code ICD_CLIENT_ID}, {@code ICD_CLIENT_SECRET}). They are read on every
 * token refresh, so a corrected file picked up by a context refresh takes
 * effect without restarting the token manager.
 */
@Component
@RequiredArgsConstructor
public class CredentialStore {

    private final RegistryProperties props;

    /**
     * @return the configured credentials
     * @throws RegistryConfigException if the client id or secret is missing
     */
    public RegistryCredentials load() {
        RegistryProperties.Credentials creds = props.getCredentials();
        if (creds == null || StringUtils.isAnyBlank(creds.getClientId(), creds.getClientSecret())) {
            throw new RegistryConfigException(
                    "ICD-11 client credentials are not configured: set ICD_CLIENT_ID and "
                            + "ICD_CLIENT_SECRET in .env (icd.registry.credentials.*)");
        }
        return new RegistryCredentials(creds.getClientId().trim(), creds.getClientSecret().trim(), props.getScope());
    }
}
