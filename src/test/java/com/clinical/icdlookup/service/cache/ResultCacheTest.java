package com.clinical.icdlookup.service.cache;

import com.clinical.icdlookup.dto.SearchQuery;
import com.clinical.icdlookup.dto.SearchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultCacheTest {

    private final ResultCache cache = new ResultCache();

    private final SearchResult asma = new SearchResult("http://id.who.int/icd/entity/854165241", "CA23", "Asma", "12", 1.0);

    @Test
    void normalizedQueriesShareOneEntry() {
        cache.put(SearchQuery.of("  Asma ", 0, 25, "ES"), List.of(asma));

        assertThat(cache.get(SearchQuery.of("asma", 0, 25, "es"))).contains(List.of(asma));
        assertThat(cache.get(SearchQuery.of("asma", 25, 25, "es"))).isEmpty();
        assertThat(cache.get(SearchQuery.of("asma", 0, 25, "en"))).isEmpty();
    }

    @Test
    void storedListIsDetachedFromCaller() {
        List<SearchResult> results = new ArrayList<>(List.of(asma));
        SearchQuery query = SearchQuery.of("asma", 0, 25, "es");
        cache.put(query, results);

        results.clear();

        assertThat(cache.get(query)).hasValueSatisfying(v -> assertThat(v).containsExactly(asma));
    }

    @Test
    void emptyResultIsCachedToo() {
        SearchQuery query = SearchQuery.of("xyzzy", 0, 25, "es");
        cache.put(query, List.of());

        assertThat(cache.get(query)).contains(List.of());
    }

    @Test
    void clearDropsEverything() {
        cache.put(SearchQuery.of("asma", 0, 25, "es"), List.of(asma));
        cache.put(SearchQuery.of("tos", 0, 25, "es"), List.of());

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.get(SearchQuery.of("asma", 0, 25, "es"))).isEmpty();
    }
}
