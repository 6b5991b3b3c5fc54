package com.clinical.icdlookup.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.util.Objects;

/**
 * One diagnostic classification match, from the live registry or the offline
 * catalog.
 *
 * @param externalId     canonical WHO entity URI, e.g. {@code http://id.who.int/icd/entity/578635574}
 * @param code           MMS code such as {@code 6A70}; absent for intermediate nodes
 * @param title          plain-text title in the requested language (markup already stripped)
 * @param chapterHint    chapter the entity belongs to, e.g. {@code 06}
 * @param relevanceScore registry relevance; never set for offline results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResult(
        String externalId,
        @Nullable String code,
        String title,
        @Nullable String chapterHint,
        @Nullable Double relevanceScore
) {

    public SearchResult {
        Objects.requireNonNull(externalId, "externalId");
        Objects.requireNonNull(title, "title");
    }
}
