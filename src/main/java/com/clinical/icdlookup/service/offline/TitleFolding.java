package com.clinical.icdlookup.service.offline;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case and accent folding shared by the catalog writer and the offline search,
 * so that "depresion" finds "Depresión".
 */
final class TitleFolding {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleFolding() {
    }

    static String fold(final String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
