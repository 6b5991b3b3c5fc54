package com.clinical.icdlookup.error;

/**
 * The registry answered 2xx but the body is not the expected search document.
 */
public class RegistryParseException extends LookupException {

    private static final long serialVersionUID = 1L;

    public RegistryParseException(final String message) {
        super(message);
    }

    public RegistryParseException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public LookupErrorKind kind() {
        return LookupErrorKind.PARSE;
    }
}
