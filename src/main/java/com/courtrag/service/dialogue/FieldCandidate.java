package com.courtrag.service.dialogue;

import com.courtrag.model.MetadataField;

import java.util.Set;

/**
 * A facet value recognized in an utterance.
 *
 * @param matchedTokens significant tokens of the value found in the utterance
 * @param tokenCount    significant tokens of the value
 * @param spans         utterance token indexes that matched
 */
record FieldCandidate(MetadataField field, String value, int matchedTokens, int tokenCount, Set<Integer> spans) {

    boolean isFullMatch() {
        return matchedTokens == tokenCount;
    }
}
