package com.courtrag.service.dialogue;

import com.courtrag.model.MetadataField;

import java.util.*;

/**
 * Outcome of one {@link QueryAnalyzer#analyze} step.
 *
 * @param filters             filters to search with (complete once ready)
 * @param residualQuery       free text left after removing recognized values
 * @param nextState           state to pass with the next utterance
 * @param clarificationPrompt question for the user, present unless ready
 * @param candidates          values offered in the question, or the values left
 *                            unresolved by a best-effort guess
 * @param bestEffort          clarification rounds ran out and a guess was taken
 */
public record AnalysisResult(
    Map<MetadataField, String> filters,
    String residualQuery,
    ConversationState nextState,
    Optional<String> clarificationPrompt,
    Map<MetadataField, List<String>> candidates,
    boolean bestEffort
) {

    public boolean isReadyToSearch() {
        return nextState.phase() == ConversationPhase.READY_TO_SEARCH;
    }

    /**
     * First field that was guessed rather than resolved.
     */
    public Optional<MetadataField> unresolvedField() {
        return bestEffort ? candidates.keySet().stream().findFirst() : Optional.empty();
    }
}
