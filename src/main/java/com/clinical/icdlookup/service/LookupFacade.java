package com.clinical.icdlookup.service;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.LookupOutcome;
import com.clinical.icdlookup.dto.SearchQuery;
import com.clinical.icdlookup.dto.SearchResult;
import com.clinical.icdlookup.error.LookupException;
import com.clinical.icdlookup.service.cache.ResultCache;
import com.clinical.icdlookup.service.offline.OfflineSearchIndex;
import com.clinical.icdlookup.service.remote.RemoteSearchClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * <h2>Diagnostic code lookup entry point</h2>
 *
 * <p>Per query:</p>
 * <ol>
 *   <li>cache hit → done;</li>
 *   <li>miss → registry search; on success the cache is populated;</li>
 *   <li>any classified registry failure → offline catalog, outcome flagged
 *       degraded and carrying the registry failure;</li>
 *   <li>offline catalog has nothing either → the Mono errors with the
 *       original registry failure, so the caller can tell the user why.</li>
 * </ol>
 * <p>Queries shorter than {@code icd.registry.min-query-length} are answered
 * with an empty outcome without consulting anything. The cache is keyed by the
 * lowercased query; the registry receives the trimmed input as typed.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LookupFacade {

    private final ResultCache cache;

    private final RemoteSearchClient remote;

    private final OfflineSearchIndex offline;

    private final RegistryProperties props;

    /**
     * Looks up {@code text} with the default offset, page size and language.
     *
     * @param text free text typed by the user
     * @return Mono emitting the outcome, or erroring with the registry's
     *         {@link LookupException} when no source has an answer
     */
    public Mono<LookupOutcome> lookup(final String text) {
        return lookup(text, 0, props.getDefaultLimit(), props.getDefaultLanguage());
    }

    public Mono<LookupOutcome> lookup(final String text, final int offset, final int limit, final String language) {
        SearchQuery query = SearchQuery.of(
                text,
                offset,
                limit > 0 ? limit : props.getDefaultLimit(),
                language == null || language.isBlank() ? props.getDefaultLanguage() : language);

        if (query.text().length() < props.getMinQueryLength()) {
            return Mono.just(LookupOutcome.empty(query));
        }

        return Mono.defer(() -> {
            Optional<List<SearchResult>> cached = cache.get(query);
            if (cached.isPresent()) {
                return Mono.just(LookupOutcome.cached(query, cached.get()));
            }
            return remote.search(text.trim(), query.offset(), query.limit(), query.language())
                    .map(results -> {
                        cache.put(query, results);
                        return LookupOutcome.live(query, results);
                    })
                    .onErrorResume(LookupException.class, failure -> fallback(query, failure));
        });
    }

    /**
     * Forgets all cached registry answers; called on logical session boundaries.
     */
    public void clearCache() {
        cache.clear();
    }

    private Mono<LookupOutcome> fallback(final SearchQuery query, final LookupException failure) {
        log.warn("ICD-11 registry unavailable for '{}' ({}: {}); falling back to offline catalog",
                query.text(), failure.kind(), failure.getMessage());
        return offline.searchOffline(query.text(), query.limit())
                .onErrorResume(ex -> {
                    log.warn("Offline catalog search failed for '{}': {}", query.text(), ex.toString());
                    return Mono.just(List.<SearchResult>of());
                })
                .flatMap(rows -> rows.isEmpty()
                        ? Mono.<LookupOutcome>error(failure)
                        : Mono.just(LookupOutcome.offline(query, rows, failure)));
    }
}
