package com.clinical.icdlookup.error;

import java.util.OptionalInt;

/**
 * The registry could not be reached, timed out, refused the call through the
 * circuit breaker, or answered with a non-2xx status other than 401.
 */
public class RegistryNetworkException extends LookupException {

    private static final long serialVersionUID = 1L;

    /** HTTP status, or {@code -1} when the failure happened below HTTP. */
    private final int statusCode;

    public RegistryNetworkException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public RegistryNetworkException(final int statusCode) {
        super("HTTP " + statusCode + " from ICD-11 registry");
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status the registry answered with, if any
     */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    public LookupErrorKind kind() {
        return LookupErrorKind.NETWORK;
    }
}
