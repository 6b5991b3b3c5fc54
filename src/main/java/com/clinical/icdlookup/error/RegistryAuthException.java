package com.clinical.icdlookup.error;

/**
 * A bearer token could not be obtained, or the registry rejected the request
 * even after one refresh-and-retry.
 */
public class RegistryAuthException extends LookupException {

    private static final long serialVersionUID = 1L;

    public RegistryAuthException(final String message) {
        super(message);
    }

    public RegistryAuthException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public LookupErrorKind kind() {
        return LookupErrorKind.AUTH;
    }
}
