package com.courtrag.service.dialogue;

import com.courtrag.dto.response.ChatResponse;
import com.courtrag.dto.response.SearchOutcome;
import com.courtrag.model.MetadataField;
import com.courtrag.service.search.HybridSearchService;
import com.courtrag.service.search.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one dialogue state per conversation and runs the search once a turn
 * leaves the analyzer ready.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    static final String BEST_EFFORT_PREFIX = "Dəqiqləşdirmə alınmadı, ən uyğun variant seçildi. ";

    private final QueryAnalyzer queryAnalyzer;
    private final HybridSearchService searchService;

    private final Map<String, ConversationState> conversations = new ConcurrentHashMap<>();

    /**
     * Handle one user turn. A missing conversation id starts a new conversation.
     */
    public ChatResponse chat(String conversationId, String message, Integer limit) {
        String id = conversationId == null || conversationId.isBlank() ? UUID.randomUUID().toString() : conversationId;

        // analysis of one conversation's turns is serialized by compute
        AtomicReference<AnalysisResult> holder = new AtomicReference<>();
        conversations.compute(id, (key, state) -> {
            if (state == null) {
                log.info("Starting conversation: {}", key);
            }
            AnalysisResult result = queryAnalyzer.analyze(message, state);
            holder.set(result);
            return result.nextState();
        });
        AnalysisResult result = holder.get();

        ChatResponse.ChatResponseBuilder response = ChatResponse.builder()
            .conversationId(id)
            .phase(result.nextState().phase().name())
            .filters(keyed(result.filters()))
            .residualQuery(result.residualQuery())
            .candidates(keyedCandidates(result.candidates()));

        if (!result.isReadyToSearch()) {
            return response.prompt(result.clarificationPrompt().orElse(null)).build();
        }

        SearchOutcome outcome = searchService.search(
            new SearchQuery(result.residualQuery(), result.filters(), limit, 0));

        if (result.bestEffort()) {
            MetadataField field = result.unresolvedField().orElseThrow();
            outcome = outcome.toBuilder()
                .bestEffort(true)
                .unresolvedField(field.getKey())
                .unresolvedCandidates(new ArrayList<>(result.candidates().get(field)))
                .message(BEST_EFFORT_PREFIX + outcome.getMessage())
                .build();
        }

        // the next message starts a new query with fresh filters
        conversations.put(id, ConversationState.initial());
        return response.outcome(outcome).build();
    }

    public boolean reset(String conversationId) {
        boolean removed = conversations.remove(conversationId) != null;
        if (removed) {
            log.info("Reset conversation: {}", conversationId);
        } else {
            log.warn("Attempted to reset non-existent conversation: {}", conversationId);
        }
        return removed;
    }

    public int activeConversations() {
        return conversations.size();
    }

    private static Map<String, String> keyed(Map<MetadataField, String> filters) {
        Map<String, String> keyed = new LinkedHashMap<>();
        filters.forEach((field, value) -> keyed.put(field.getKey(), value));
        return keyed;
    }

    private static Map<String, List<String>> keyedCandidates(Map<MetadataField, List<String>> candidates) {
        Map<String, List<String>> keyed = new LinkedHashMap<>();
        candidates.forEach((field, values) -> keyed.put(field.getKey(), values));
        return keyed;
    }
}
