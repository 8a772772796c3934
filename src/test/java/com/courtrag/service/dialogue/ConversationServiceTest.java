package com.courtrag.service.dialogue;

import com.courtrag.dto.response.ChatResponse;
import com.courtrag.dto.response.SearchOutcome;
import com.courtrag.dto.response.SearchStatus;
import com.courtrag.model.MetadataField;
import com.courtrag.service.search.HybridSearchService;
import com.courtrag.service.search.SearchQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationServiceTest {

    private static final Map<MetadataField, List<String>> JUDGES =
        Map.of(MetadataField.JUDGE, List.of("Kamran", "Kamran Əliyev"));

    private QueryAnalyzer analyzer;
    private HybridSearchService searchService;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        analyzer = mock(QueryAnalyzer.class);
        searchService = mock(HybridSearchService.class);
        service = new ConversationService(analyzer, searchService);
    }

    private static AnalysisResult question() {
        ConversationState waiting = new ConversationState(
            ConversationPhase.AWAITING_CLARIFICATION, Map.of(), "torpaq", JUDGES, 1);
        return new AnalysisResult(Map.of(), "torpaq", waiting, Optional.of("Hansını?"), JUDGES, false);
    }

    private static AnalysisResult ready(Map<MetadataField, String> filters, boolean bestEffort) {
        ConversationState done = new ConversationState(
            ConversationPhase.READY_TO_SEARCH, filters, "torpaq", Map.of(), 0);
        return new AnalysisResult(filters, "torpaq", done, Optional.empty(), bestEffort ? JUDGES : Map.of(), bestEffort);
    }

    private static SearchOutcome found() {
        return SearchOutcome.builder()
            .status(SearchStatus.OK)
            .totalMatches(1)
            .message("1 qərar tapıldı.")
            .build();
    }

    @Test
    void shouldReturnPromptWithoutSearching() {
        when(analyzer.analyze(eq("Kamranın qərarları"), isNull())).thenReturn(question());

        ChatResponse response = service.chat(null, "Kamranın qərarları", null);

        assertNotNull(response.getConversationId());
        assertEquals("AWAITING_CLARIFICATION", response.getPhase());
        assertEquals("Hansını?", response.getPrompt());
        assertEquals(List.of("Kamran", "Kamran Əliyev"), response.getCandidates().get("judge"));
        assertNull(response.getOutcome());
        verify(searchService, never()).search(any());
        assertEquals(1, service.activeConversations());
    }

    @Test
    void shouldPassStateToNextTurnAndSearchWhenReady() {
        AnalysisResult asked = question();
        when(analyzer.analyze(eq("Kamranın qərarları"), isNull())).thenReturn(asked);
        when(analyzer.analyze(eq("2"), eq(asked.nextState())))
            .thenReturn(ready(Map.of(MetadataField.JUDGE, "Kamran Əliyev"), false));
        when(searchService.search(any())).thenReturn(found());

        String id = service.chat("conv-1", "Kamranın qərarları", null).getConversationId();
        ChatResponse response = service.chat(id, "2", 5);

        ArgumentCaptor<SearchQuery> query = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchService).search(query.capture());
        assertEquals("torpaq", query.getValue().text());
        assertEquals("Kamran Əliyev", query.getValue().filters().get(MetadataField.JUDGE));
        assertEquals(5, query.getValue().limit());

        assertEquals("conv-1", response.getConversationId());
        assertEquals(Map.of("judge", "Kamran Əliyev"), response.getFilters());
        assertEquals(SearchStatus.OK, response.getOutcome().getStatus());
        assertFalse(response.getOutcome().isBestEffort());
    }

    @Test
    void shouldStartFreshQueryAfterSearch() {
        when(analyzer.analyze(any(), any())).thenReturn(ready(Map.of(), false));
        when(searchService.search(any())).thenReturn(found());

        service.chat("conv-2", "torpaq", null);
        service.chat("conv-2", "torpaq", null);

        ArgumentCaptor<ConversationState> states = ArgumentCaptor.forClass(ConversationState.class);
        verify(analyzer, times(2)).analyze(any(), states.capture());
        assertNull(states.getAllValues().get(0));
        assertEquals(ConversationState.initial(), states.getAllValues().get(1));
    }

    @Test
    void shouldMarkBestEffortOutcome() {
        when(analyzer.analyze(any(), any())).thenReturn(ready(Map.of(MetadataField.JUDGE, "Kamran Əliyev"), true));
        when(searchService.search(any())).thenReturn(found());

        SearchOutcome outcome = service.chat("conv-3", "bilmirəm", null).getOutcome();

        assertTrue(outcome.isBestEffort());
        assertEquals("judge", outcome.getUnresolvedField());
        assertEquals(List.of("Kamran", "Kamran Əliyev"), outcome.getUnresolvedCandidates());
        assertEquals(ConversationService.BEST_EFFORT_PREFIX + "1 qərar tapıldı.", outcome.getMessage());
    }

    @Test
    void shouldResetKnownConversationOnly() {
        when(analyzer.analyze(any(), any())).thenReturn(question());
        service.chat("conv-4", "Kamran", null);

        assertTrue(service.reset("conv-4"));
        assertFalse(service.reset("conv-4"));
        assertEquals(0, service.activeConversations());
    }
}
