package com.clinical.icdlookup.error;

/**
 * Client credentials for the registry are missing or incomplete.
 * <p>
 * Extends {@link RegistryAuthException} because it surfaces from the token
 * path, but keeps its own {@link LookupErrorKind#CONFIG} kind so callers can
 * tell a setup problem apart from a rejected or unreachable token endpoint.
 */
public class RegistryConfigException extends RegistryAuthException {

    private static final long serialVersionUID = 1L;

    public RegistryConfigException(final String message) {
        super(message);
    }

    @Override
    public LookupErrorKind kind() {
        return LookupErrorKind.CONFIG;
    }
}
