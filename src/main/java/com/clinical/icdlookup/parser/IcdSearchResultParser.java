package com.clinical.icdlookup.parser;

import com.clinical.icdlookup.dto.SearchResult;
import com.clinical.icdlookup.error.RegistryParseException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <h2>ICD-11 flat search parser</h2>
 * <p>Converts the body of <code>/icd/release/11/{release}/mms/search</code>
 * into {@link SearchResult} values. The relevant part of the response is:</p>
 * <pre>{@code
 * {
 *   "error": false,
 *   "destinationEntities": [
 *     { "id": "http://id.who.int/icd/entity/1",
 *       "title": "<em class='found'>Depresión</em> de episodio único",
 *       "theCode": "6A70", "chapter": "06", "score": 0.93 },
 *     …
 *   ]
 * }
 * }</pre>
 * <p>The registry schema leaves most fields optional and is not always
 * consistent, so each entity is validated on its own:</p>
 * <ol>
 *     <li>an entity without a textual {@code id} or {@code title} is skipped;</li>
 *     <li>highlight markup in {@code title} is reduced to plain text;</li>
 *     <li>blank {@code theCode} / {@code chapter} become absent values;</li>
 *     <li>a non-numeric {@code score} is ignored.</li>
 * </ol>
 * <p>Only a document that is not an object with a {@code destinationEntities}
 * array fails the whole parse.</p>
 */
@Slf4j
@Component("icdSearchParser")
public final class IcdSearchResultParser implements SearchResultParser {

    private static final String FIELD_ENTITIES = "destinationEntities";
    private static final String FIELD_ID = "id";
    private static final String FIELD_TITLE = "title";
    private static final String FIELD_CODE = "theCode";
    private static final String FIELD_CHAPTER = "chapter";
    private static final String FIELD_SCORE = "score";

    @Override
    public List<SearchResult> parse(final JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new RegistryParseException("Registry response is not a JSON object");
        }
        JsonNode entities = root.get(FIELD_ENTITIES);
        if (entities == null || !entities.isArray()) {
            throw new RegistryParseException("Registry response has no '" + FIELD_ENTITIES + "' array");
        }

        List<SearchResult> results = new ArrayList<>(entities.size());
        int skipped = 0;
        for (JsonNode entity : entities) {
            SearchResult result = toResult(entity);
            if (result == null) {
                skipped++;
            } else {
                results.add(result);
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} registry entities without id/title", skipped);
        }
        return Collections.unmodifiableList(results);
    }

    @Nullable
    private static SearchResult toResult(final JsonNode entity) {
        String id = text(entity, FIELD_ID);
        String titleHtml = text(entity, FIELD_TITLE);
        if (id == null || titleHtml == null) {
            return null;
        }
        return new SearchResult(
                id,
                text(entity, FIELD_CODE),
                stripMarkup(titleHtml),
                text(entity, FIELD_CHAPTER),
                score(entity));
    }

    /**
     * Reduces registry highlight markup ({@code <em class='found'>…</em>}) and
     * any other tags to plain text; entities such as {@code &amp;} are decoded.
     *
     * @param html title as returned by the registry
     * @return plain text with collapsed whitespace
     */
    static String stripMarkup(final String html) {
        if (html.indexOf('<') < 0 && html.indexOf('&') < 0) {
            return html.trim();
        }
        return Jsoup.parseBodyFragment(html).text();
    }

    @Nullable
    private static String text(final JsonNode entity, final String field) {
        JsonNode node = entity.get(field);
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return StringUtils.hasText(value) ? value : null;
    }

    @Nullable
    private static Double score(final JsonNode entity) {
        JsonNode node = entity.get(FIELD_SCORE);
        return node != null && node.isNumber() ? node.doubleValue() : null;
    }
}
