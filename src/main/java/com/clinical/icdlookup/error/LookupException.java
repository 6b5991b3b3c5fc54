package com.clinical.icdlookup.error;

/**
 * Base type of every classified failure raised by the lookup components.
 * <p>
 * Reactor pipelines translate foreign exceptions (WebClient, Jackson,
 * Resilience4j, Spring JDBC) into a subclass at the component boundary, so
 * the facade only ever has to reason about this hierarchy.
 */
public abstract class LookupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected LookupException(final String message) {
        super(message);
    }

    protected LookupException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the failure category, used for logging and the REST error body
     */
    public abstract LookupErrorKind kind();
}
