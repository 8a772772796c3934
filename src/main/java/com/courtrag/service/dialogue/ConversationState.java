package com.courtrag.service.dialogue;

import com.courtrag.model.MetadataField;

import java.util.*;

/**
 * Immutable dialogue state threaded through {@link QueryAnalyzer#analyze}.
 *
 * @param filters         filters resolved so far
 * @param pendingResidual free-text part of the query waiting for clarification
 * @param pending         ambiguous fields in asking order, with their candidates
 * @param roundsUsed      clarification questions asked in this conversation
 */
public record ConversationState(
    ConversationPhase phase,
    Map<MetadataField, String> filters,
    String pendingResidual,
    Map<MetadataField, List<String>> pending,
    int roundsUsed
) {

    private static final ConversationState INITIAL =
        new ConversationState(ConversationPhase.AWAITING_QUERY, Map.of(), "", Map.of(), 0);

    public ConversationState {
        filters = filters.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(filters));
        pendingResidual = pendingResidual == null ? "" : pendingResidual;
        Map<MetadataField, List<String>> copy = new LinkedHashMap<>();
        pending.forEach((field, candidates) -> copy.put(field, List.copyOf(candidates)));
        pending = Collections.unmodifiableMap(copy);
    }

    public static ConversationState initial() {
        return INITIAL;
    }

    /**
     * Field the next reply is expected to resolve.
     */
    public Optional<MetadataField> pendingField() {
        return pending.keySet().stream().findFirst();
    }

    public List<String> pendingCandidates() {
        return pendingField().map(pending::get).orElse(List.of());
    }
}
