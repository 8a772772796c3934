package com.courtrag.model;

import java.util.*;

/**
 * Fixed set of case attributes extracted from a ruling.
 */
public enum MetadataField {

    COURT_NAME("court_name", "məhkəmə"),
    CASE_NUMBER("case_number", "iş nömrəsi"),
    JUDGE("judge", "hakim"),
    CASE_TYPE("case_type", "işin növü"),
    DISTRICT("district", "rayon"),
    DECISION_TYPE("decision_type", "qərarın növü"),
    YEAR("year", "il"),
    DECISION_DATE("decision_date", "qərarın tarixi"),
    PARTIES("parties", "tərəflər");

    private final String key;
    private final String label;

    MetadataField(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * Wire name used in filters, facets and serialized metadata.
     */
    public String getKey() {
        return key;
    }

    /**
     * Azerbaijani display name used in clarification prompts.
     */
    public String getLabel() {
        return label;
    }

    public boolean isMultiValued() {
        return this == PARTIES;
    }

    /**
     * Resolves a field from its wire name, its enum name, or the short
     * {@code court} alias accepted by the filter API.
     */
    public static Optional<MetadataField> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("court".equals(normalized)) {
            return Optional.of(COURT_NAME);
        }
        if ("date".equals(normalized)) {
            return Optional.of(DECISION_DATE);
        }
        for (MetadataField field : values()) {
            if (field.key.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
