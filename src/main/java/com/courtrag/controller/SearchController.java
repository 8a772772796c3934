package com.courtrag.controller;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.courtrag.dto.request.ChatRequest;
import com.courtrag.dto.request.SearchRequest;
import com.courtrag.dto.response.ChatResponse;
import com.courtrag.dto.response.SearchOutcome;
import com.courtrag.model.MetadataField;
import com.courtrag.service.dialogue.ConversationService;
import com.courtrag.service.index.FacetCache;
import com.courtrag.service.ingestion.IngestionService;
import com.courtrag.service.monitoring.SearchStatisticsService;
import com.courtrag.service.search.HybridSearchService;
import com.courtrag.service.search.SearchQuery;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = {"http://localhost:3000", "http://localhost:3001", "http://127.0.0.1:3000"})
public class SearchController {

    private final HybridSearchService searchService;
    private final ConversationService conversationService;
    private final FacetCache facetCache;
    private final IngestionService ingestionService;
    private final SearchStatisticsService statisticsService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Court Rulings Search API");
        health.put("index", ingestionService.statistics());
        health.put("active_conversations", conversationService.activeConversations());
        return ResponseEntity.ok(health);
    }

    @PostMapping("/search")
    public ResponseEntity<SearchOutcome> search(@Valid @RequestBody SearchRequest request) {
        log.info("Search received: '{}' filters={}", request.getQuery(), request.getFilters());
        SearchQuery query = new SearchQuery(
            request.getQuery(),
            toFilters(request.getFilters()),
            request.getLimit(),
            request.getOffset() == null ? 0 : request.getOffset());
        return ResponseEntity.ok(searchService.search(query));
    }

    @GetMapping("/facets")
    public ResponseEntity<Map<String, List<String>>> facets() {
        Map<String, List<String>> facets = new LinkedHashMap<>();
        facetCache.snapshot().forEach((field, values) -> facets.put(field.getKey(), values));
        return ResponseEntity.ok(facets);
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat message in {}: {}", request.getConversationId(), request.getMessage());
        return ResponseEntity.ok(conversationService.chat(
            request.getConversationId(), request.getMessage(), request.getLimit()));
    }

    @DeleteMapping("/chat/{conversationId}")
    public ResponseEntity<Map<String, Object>> resetChat(@PathVariable String conversationId) {
        boolean removed = conversationService.reset(conversationId);
        return ResponseEntity.ok(Map.of("conversationId", conversationId, "reset", removed));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("index", ingestionService.statistics());
        stats.put("search", statisticsService.getStatistics());
        return ResponseEntity.ok(stats);
    }

    /**
     * Maps filter keys to fields; blank values are ignored, unknown keys rejected.
     */
    static Map<MetadataField, String> toFilters(Map<String, String> raw) {
        Map<MetadataField, String> filters = new EnumMap<>(MetadataField.class);
        if (raw == null) {
            return filters;
        }
        raw.forEach((key, value) -> {
            MetadataField field = MetadataField.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown filter field: " + key));
            if (value != null && !value.isBlank()) {
                filters.put(field, value.strip());
            }
        });
        return filters;
    }
}
