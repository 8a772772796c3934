package com.courtrag.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.courtrag.exception.InvalidConfigurationException;
import com.courtrag.service.dialogue.CandidatePriority;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Tunables of the ingestion and retrieval pipeline, bound from {@code court-rag.*}.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "court-rag")
public class CourtRagProperties {

    private Chunking chunking = new Chunking();
    private Search search = new Search();
    private Dialogue dialogue = new Dialogue();
    private Extraction extraction = new Extraction();
    private Ingestion ingestion = new Ingestion();
    private Executors executors = new Executors();

    // ============================================================
    // Chunking
    // ============================================================
    @Data
    public static class Chunking {
        private Integer maxChars;
        private Integer overlapChars;
        private Integer minOverlapChars;
    }

    // ============================================================
    // Search
    // ============================================================
    @Data
    public static class Search {
        private Integer defaultLimit;
        private Integer maxLimit;
        private Double minRelevance;
        private Double ambiguityPenalty;
        private Long timeoutMillis;
    }

    // ============================================================
    // Dialogue
    // ============================================================
    @Data
    public static class Dialogue {
        private Integer maxClarificationRounds;
        private Integer ambiguityMinCandidates;
        private CandidatePriority priority;
    }

    // ============================================================
    // Extraction
    // ============================================================
    @Data
    public static class Extraction {
        private List<String> knownCourts = new ArrayList<>();
        private List<String> knownDistricts = new ArrayList<>();
    }

    // ============================================================
    // Ingestion
    // ============================================================
    @Data
    public static class Ingestion {
        private String corpusPath;
        private Boolean loadOnStartup;
        private Integer excerptChars;
    }

    @Data
    public static class Executors {
        private Integer ingestionThreads;
        private Integer searchThreads;
        private Integer embeddingThreads;
        private Integer queueCapacity;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getMaxChunkChars() {
        return chunking.getMaxChars() != null ? chunking.getMaxChars() : 1000;
    }

    public int getOverlapChars() {
        return chunking.getOverlapChars() != null ? chunking.getOverlapChars() : 150;
    }

    public int getMinOverlapChars() {
        return chunking.getMinOverlapChars() != null ? chunking.getMinOverlapChars() : 100;
    }

    public int getDefaultLimit() {
        return search.getDefaultLimit() != null ? search.getDefaultLimit() : 10;
    }

    public int getMaxLimit() {
        return search.getMaxLimit() != null ? search.getMaxLimit() : 100;
    }

    public double getMinRelevance() {
        return search.getMinRelevance() != null ? search.getMinRelevance() : 0.35;
    }

    public double getAmbiguityPenalty() {
        return search.getAmbiguityPenalty() != null ? search.getAmbiguityPenalty() : 0.05;
    }

    public long getSearchTimeoutMillis() {
        return search.getTimeoutMillis() != null ? search.getTimeoutMillis() : 5000L;
    }

    public int getMaxClarificationRounds() {
        return dialogue.getMaxClarificationRounds() != null ? dialogue.getMaxClarificationRounds() : 2;
    }

    public int getAmbiguityMinCandidates() {
        return dialogue.getAmbiguityMinCandidates() != null ? dialogue.getAmbiguityMinCandidates() : 2;
    }

    public CandidatePriority getCandidatePriority() {
        return dialogue.getPriority() != null ? dialogue.getPriority() : CandidatePriority.DOCUMENT_COUNT;
    }

    public int getExcerptChars() {
        return ingestion.getExcerptChars() != null ? ingestion.getExcerptChars() : 300;
    }

    public boolean isLoadOnStartup() {
        return Boolean.TRUE.equals(ingestion.getLoadOnStartup());
    }

    public int getIngestionThreads() {
        return executors.getIngestionThreads() != null ? executors.getIngestionThreads() : 4;
    }

    public int getSearchThreads() {
        return executors.getSearchThreads() != null ? executors.getSearchThreads() : 8;
    }

    public int getEmbeddingThreads() {
        return executors.getEmbeddingThreads() != null ? executors.getEmbeddingThreads() : 4;
    }

    public int getQueueCapacity() {
        return executors.getQueueCapacity() != null ? executors.getQueueCapacity() : 200;
    }

    // ============================================================
    // Initialization & Validation
    // ============================================================

    @PostConstruct
    public void init() {
        validate();

        log.info("=".repeat(70));
        log.info("COURT RAG CONFIGURATION INITIALIZED");
        log.info("=".repeat(70));
        log.info("CHUNKING: max={} overlap={} minOverlap={}",
            getMaxChunkChars(), getOverlapChars(), getMinOverlapChars());
        log.info("SEARCH: limit={}/{} minRelevance={} penalty={} timeout={}ms",
            getDefaultLimit(), getMaxLimit(), getMinRelevance(), getAmbiguityPenalty(), getSearchTimeoutMillis());
        log.info("DIALOGUE: rounds={} ambiguityAt={} priority={}",
            getMaxClarificationRounds(), getAmbiguityMinCandidates(), getCandidatePriority());
        log.info("CATALOG: {} courts, {} districts",
            extraction.getKnownCourts().size(), extraction.getKnownDistricts().size());
        log.info("=".repeat(70));
    }

    public void validate() {
        int max = getMaxChunkChars();
        int overlap = getOverlapChars();
        int min = getMinOverlapChars();
        if (min <= 0 || min > overlap || overlap * 2 >= max) {
            throw new InvalidConfigurationException(String.format(
                "Invalid chunking: require 0 < min-overlap-chars (%d) <= overlap-chars (%d) < max-chars (%d) / 2",
                min, overlap, max));
        }
        if (getDefaultLimit() <= 0 || getDefaultLimit() > getMaxLimit()) {
            throw new InvalidConfigurationException("Invalid search limits: 0 < default-limit <= max-limit");
        }
        if (getMinRelevance() < -1.0 || getMinRelevance() > 1.0) {
            throw new InvalidConfigurationException("search.min-relevance must lie in [-1, 1]");
        }
        if (getSearchTimeoutMillis() <= 0) {
            throw new InvalidConfigurationException("search.timeout-millis must be positive");
        }
        if (getMaxClarificationRounds() < 1) {
            throw new InvalidConfigurationException("dialogue.max-clarification-rounds must be at least 1");
        }
        if (getAmbiguityMinCandidates() < 2) {
            throw new InvalidConfigurationException("dialogue.ambiguity-min-candidates must be at least 2");
        }
    }
}
