package com.clinical.icdlookup.service.offline;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * One element of the bundled dataset array.
 */
record SeedRow(String code, String title, String uri, String classKind, String chapterCode) {

    /**
     * @return the catalog row, or empty when title, uri or kind is unusable
     */
    Optional<CatalogEntry> toEntry() {
        if (StringUtils.isAnyBlank(title, uri)) {
            return Optional.empty();
        }
        return ClassKind.fromWireName(classKind)
                .map(kind -> new CatalogEntry(
                        UUID.randomUUID(),
                        StringUtils.trimToEmpty(code),
                        title.trim(),
                        uri.trim(),
                        kind,
                        StringUtils.trimToEmpty(chapterCode)));
    }
}
