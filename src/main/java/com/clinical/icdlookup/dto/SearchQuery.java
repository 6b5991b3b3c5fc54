package com.clinical.icdlookup.dto;

import java.util.Locale;

/**
 * Normalized search parameters; record equality makes it the result-cache key.
 * <p>
 * Two inputs that differ only in casing or surrounding whitespace produce equal
 * queries.
 *
 * @param text     trimmed, lowercased free text
 * @param offset   zero-based page offset
 * @param limit    page size
 * @param language lowercased language tag sent as {@code Accept-Language}
 */
public record SearchQuery(String text, int offset, int limit, String language) {

    public static SearchQuery of(final String rawText, final int offset, final int limit, final String language) {
        String text = rawText == null ? "" : rawText.trim().toLowerCase(Locale.ROOT);
        String lang = language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
        return new SearchQuery(text, Math.max(offset, 0), limit, lang);
    }
}
