package com.clinical.icdlookup.service.cache;

import com.clinical.icdlookup.dto.SearchQuery;
import com.clinical.icdlookup.dto.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-lifetime cache of registry results keyed by {@link SearchQuery}.
 * <p>
 * There is no TTL: entries live until {@link #clear()} is called on a logical
 * session boundary or the process restarts. Values are immutable copies
 * published through a {@link ConcurrentHashMap}, so concurrent searches never
 * see a half-written list.
 */
@Slf4j
@Component
public class ResultCache {

    private final Map<SearchQuery, CacheEntry> entries = new ConcurrentHashMap<>();

    private final Clock clock = Clock.systemUTC();

    public Optional<List<SearchResult>> get(final SearchQuery query) {
        CacheEntry entry = entries.get(query);
        if (entry == null) {
            return Optional.empty();
        }
        log.debug("Result cache hit for '{}' (cached at {})", query.text(), entry.createdAt());
        return Optional.of(entry.value());
    }

    public void put(final SearchQuery query, final List<SearchResult> results) {
        entries.put(query, new CacheEntry(query, List.copyOf(results), clock.instant()));
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("Result cache cleared ({} entries)", size);
    }

    public int size() {
        return entries.size();
    }

    /**
     * One cached answer.
     *
     * @param key       normalized query
     * @param value     immutable result list
     * @param createdAt when the registry answered
     */
    record CacheEntry(SearchQuery key, List<SearchResult> value, Instant createdAt) {
    }
}
