package com.clinical.icdlookup.error;

/**
 * Classification of lookup failures as seen by callers of the facade.
 * <p>
 * A query that is too short is not represented here: it is answered with an
 * empty result instead of an error.
 */
public enum LookupErrorKind {

    /** Transport failure, timeout, non-2xx status or an open circuit. */
    NETWORK,

    /** Token could not be obtained, or the registry kept rejecting it. */
    AUTH,

    /** Client credentials are missing or incomplete. */
    CONFIG,

    /** Registry answered with a body of unexpected shape. */
    PARSE,

    /** Bundled dataset could not be read or decoded during import. */
    SEED
}
