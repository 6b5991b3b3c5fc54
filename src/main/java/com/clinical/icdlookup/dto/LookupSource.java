package com.clinical.icdlookup.dto;

/**
 * Where the results of a lookup came from.
 */
public enum LookupSource {

    /** Fresh answer from the registry. */
    LIVE,

    /** Served from the session result cache. */
    CACHE,

    /** Registry failed; served from the local catalog (degraded). */
    OFFLINE
}
