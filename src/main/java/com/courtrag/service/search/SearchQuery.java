package com.courtrag.service.search;

import com.courtrag.model.MetadataField;

import java.util.*;

/**
 * Free text (may be blank) plus a conjunction of field filters.
 *
 * @param limit  page size; {@code null} selects the configured default
 * @param offset number of ranked documents to skip
 */
public record SearchQuery(String text, Map<MetadataField, String> filters, Integer limit, int offset) {

    public SearchQuery {
        text = text == null ? "" : text.strip();
        filters = filters == null || filters.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(filters));
        offset = Math.max(0, offset);
    }

    public static SearchQuery of(String text, Map<MetadataField, String> filters) {
        return new SearchQuery(text, filters, null, 0);
    }

    public boolean hasText() {
        return !text.isEmpty();
    }
}
