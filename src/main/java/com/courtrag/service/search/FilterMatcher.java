package com.courtrag.service.search;

import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import com.courtrag.util.TextNormalizer;

import java.util.Map;

/**
 * Filter semantics shared by search and dialogue narrowing: a record satisfies
 * a filter when the field is known and equal after Azerbaijani case folding and
 * whitespace collapse. A party filter matches any one party.
 */
public final class FilterMatcher {

    private FilterMatcher() {
    }

    public static boolean matchesAll(MetadataRecord metadata, Map<MetadataField, String> filters) {
        for (Map.Entry<MetadataField, String> filter : filters.entrySet()) {
            if (!matches(metadata, filter.getKey(), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(MetadataRecord metadata, MetadataField field, String required) {
        String wanted = TextNormalizer.fold(required);
        if (wanted.isEmpty()) {
            return false;
        }
        for (String value : metadata.values(field)) {
            if (TextNormalizer.fold(value).equals(wanted)) {
                return true;
            }
        }
        return false;
    }
}
