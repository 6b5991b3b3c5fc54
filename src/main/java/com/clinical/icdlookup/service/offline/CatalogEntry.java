package com.clinical.icdlookup.service.offline;

import java.util.UUID;

/**
 * One row of the offline catalog. Created only by {@link CatalogSeeder}.
 *
 * @param id          surrogate key
 * @param code        MMS code, empty for nodes without one
 * @param title       title in the catalog language
 * @param uri         canonical WHO entity URI
 * @param classKind   node type
 * @param chapterCode root chapter, e.g. {@code 06}
 */
public record CatalogEntry(UUID id, String code, String title, String uri, ClassKind classKind,
                           String chapterCode) {
}
