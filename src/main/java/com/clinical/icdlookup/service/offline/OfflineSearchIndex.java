package com.clinical.icdlookup.service.offline;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Substring search over the offline catalog, used when the registry fails.
 * <p>
 * Matching is case- and accent-insensitive containment on the title and is
 * restricted to assignable categories; chapters, blocks and windows are not
 * valid diagnoses. No relevance is computed: results come back ordered by
 * code, which is stable for repeated identical queries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineSearchIndex {

    private final OfflineCatalogStore store;

    private final RegistryProperties props;

    /**
     * @param text  free text
     * @param limit maximum results; non-positive means the configured default
     * @return Mono emitting matching entries as search results
     */
    public Mono<List<SearchResult>> searchOffline(final String text, final int limit) {
        String folded = TitleFolding.fold(text);
        if (folded.isEmpty()) {
            return Mono.just(List.of());
        }
        int cap = limit > 0 ? limit : props.getDefaultLimit();
        return Mono.fromCallable(() -> store.findAssignableByTitle(folded, cap))
                .subscribeOn(Schedulers.boundedElastic())
                .map(rows -> rows.stream().map(OfflineSearchIndex::toResult).toList())
                .doOnNext(results -> log.debug("Offline search '{}' → {} result(s)", folded, results.size()));
    }

    private static SearchResult toResult(final CatalogEntry entry) {
        return new SearchResult(
                entry.uri(),
                StringUtils.defaultIfBlank(entry.code(), null),
                entry.title(),
                StringUtils.defaultIfBlank(entry.chapterCode(), null),
                null);
    }
}
