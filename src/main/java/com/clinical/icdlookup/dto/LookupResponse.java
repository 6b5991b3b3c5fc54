package com.clinical.icdlookup.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * REST view of a {@link LookupOutcome}.
 *
 * @param query         normalized query text
 * @param results       matches
 * @param source        LIVE, CACHE or OFFLINE
 * @param degraded      {@code true} when the UI should show the offline badge
 * @param remoteFailure human-readable reason the registry was bypassed, if it was
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LookupResponse(
        String query,
        List<SearchResult> results,
        LookupSource source,
        boolean degraded,
        String remoteFailure
) {

    public static LookupResponse from(final LookupOutcome outcome) {
        return new LookupResponse(
                outcome.query().text(),
                outcome.results(),
                outcome.source(),
                outcome.isDegraded(),
                outcome.failure().map(Throwable::getMessage).orElse(null));
    }
}
