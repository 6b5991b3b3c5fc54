package com.clinical.icdlookup.parser;

import com.clinical.icdlookup.dto.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Converts a registry search payload into normalized results.
 */
@FunctionalInterface
public interface SearchResultParser {

    /**
     * @param root complete JSON document returned by the registry
     * @return     matches in registry order – may be empty but never {@code null}
     * @throws com.clinical.icdlookup.error.RegistryParseException if the document
     *         is not a search response at all
     */
    List<SearchResult> parse(JsonNode root);

}
