package com.clinical.icdlookup.error;

/**
 * The bundled catalog dataset could not be read, decoded or written during the
 * one-time import.
 */
public class CatalogSeedException extends LookupException {

    private static final long serialVersionUID = 1L;

    public CatalogSeedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public LookupErrorKind kind() {
        return LookupErrorKind.SEED;
    }
}
