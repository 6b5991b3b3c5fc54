package com.clinical.icdlookup.service.offline;

import com.clinical.icdlookup.config.RegistryProperties;
import com.clinical.icdlookup.dto.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.clinical.icdlookup.service.offline.CatalogTestDatabase.entry;
import static org.assertj.core.api.Assertions.assertThat;

class OfflineSearchIndexTest {

    private CatalogTestDatabase db;

    private OfflineSearchIndex index;

    @BeforeEach
    void setUp() {
        db = new CatalogTestDatabase();
        OfflineCatalogStore store = db.store();
        store.insertBatch(List.of(
                entry("06", "Trastornos mentales, del comportamiento o del neurodesarrollo", ClassKind.CHAPTER, "06"),
                entry("", "Trastornos de ansiedad o relacionados con el miedo", ClassKind.BLOCK, "06"),
                entry("6B00", "Trastorno de ansiedad generalizada", ClassKind.CATEGORY, "06"),
                entry("6A70", "Depresión de episodio único", ClassKind.CATEGORY, "06")));
        index = new OfflineSearchIndex(store, new RegistryProperties());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void findsCategoryBySubstring() {
        List<SearchResult> results = index.searchOffline("ansiedad", 10).block();

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.title()).isEqualTo("Trastorno de ansiedad generalizada");
            assertThat(r.code()).isEqualTo("6B00");
            assertThat(r.chapterHint()).isEqualTo("06");
            assertThat(r.externalId()).startsWith("http://id.who.int/icd/release/11/2024-01/mms/");
            assertThat(r.relevanceScore()).isNull();
        });
    }

    @Test
    void matchingIgnoresCaseAndAccents() {
        assertThat(index.searchOffline("DEPRESION", 10).block())
                .extracting(SearchResult::code).containsExactly("6A70");
    }

    @Test
    void chaptersAndBlocksAreNeverReturned() {
        assertThat(index.searchOffline("trastornos", 10).block()).isEmpty();
    }

    @Test
    void blankTextGivesNoResults() {
        StepVerifier.create(index.searchOffline("   ", 10))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void repeatedQueryGivesSameOrder() {
        List<SearchResult> first = index.searchOffline("o", 0).block();
        List<SearchResult> second = index.searchOffline("o", 0).block();

        assertThat(first).isEqualTo(second).extracting(SearchResult::code).containsExactly("6A70", "6B00");
    }
}
