package com.clinical.icdlookup.dto;

import com.clinical.icdlookup.error.LookupException;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Result of one facade lookup.
 *
 * @param query         the normalized query that was answered
 * @param results       immutable list of matches, possibly empty
 * @param source        where the results came from
 * @param remoteFailure why the registry could not answer; only set for offline results
 */
public record LookupOutcome(
        SearchQuery query,
        List<SearchResult> results,
        LookupSource source,
        @Nullable LookupException remoteFailure
) {

    public LookupOutcome {
        results = List.copyOf(results);
    }

    public static LookupOutcome live(final SearchQuery query, final List<SearchResult> results) {
        return new LookupOutcome(query, results, LookupSource.LIVE, null);
    }

    public static LookupOutcome cached(final SearchQuery query, final List<SearchResult> results) {
        return new LookupOutcome(query, results, LookupSource.CACHE, null);
    }

    public static LookupOutcome offline(final SearchQuery query,
                                        final List<SearchResult> results,
                                        final LookupException remoteFailure) {
        return new LookupOutcome(query, results, LookupSource.OFFLINE, remoteFailure);
    }

    public static LookupOutcome empty(final SearchQuery query) {
        return live(query, List.of());
    }

    /**
     * @return {@code true} when the results come from the offline catalog
     */
    public boolean isDegraded() {
        return source == LookupSource.OFFLINE;
    }

    public Optional<LookupException> failure() {
        return Optional.ofNullable(remoteFailure);
    }
}
