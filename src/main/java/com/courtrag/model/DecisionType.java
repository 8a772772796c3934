package com.courtrag.model;

import com.courtrag.util.TextNormalizer;

import java.util.Optional;

/**
 * Closed set of court act categories.
 */
public enum DecisionType {

    QETNAME("QƏTNAMƏ"),
    QERARNAME("QƏRARNAMƏ"),
    QERAR("QƏRAR"),
    HOKM("HÖKM");

    private final String label;

    DecisionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Maps free text to a decision type. The longer labels are checked first
     * because {@code QƏRAR} is a prefix of {@code QƏRARNAMƏ}.
     */
    public static Optional<DecisionType> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String folded = TextNormalizer.foldOcr(text);
        for (DecisionType type : values()) {
            if (folded.startsWith(TextNormalizer.foldOcr(type.label))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
