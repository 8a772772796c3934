package com.courtrag.service.search;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.dto.internal.TimingInfo;
import com.courtrag.dto.response.SearchHit;
import com.courtrag.dto.response.SearchOutcome;
import com.courtrag.dto.response.SearchStatus;
import com.courtrag.exception.CourtRagException;
import com.courtrag.exception.EmbeddingException;
import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;
import com.courtrag.model.MetadataField;
import com.courtrag.service.embedding.EmbeddingGateway;
import com.courtrag.service.index.VectorIndex;
import com.courtrag.service.monitoring.SearchStatisticsService;
import com.courtrag.service.monitoring.SearchTimer;
import com.courtrag.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Metadata filtering combined with vector similarity ranking.
 *
 * <p>Filters are a strict conjunction over each entry's metadata snapshot.
 * With query text, every embedded chunk of every candidate is scored by cosine
 * similarity, chunks under the relevance threshold are dropped and each
 * document keeps its best chunk. Without text, candidates are browsed newest
 * first. Each search runs on the search executor under a wall-clock budget.</p>
 */
@Slf4j
@Service
public class HybridSearchService {

    static final String MSG_NO_MATCHES = "Göstərilən filtrlərə uyğun sənəd tapılmadı.";
    static final String MSG_NOT_RELEVANT = "Sorğuya kifayət qədər uyğun nəticə tapılmadı. Sorğunu dəqiqləşdirin.";
    static final String MSG_TIMEOUT = "Axtarış vaxt limitini aşdı. Yenidən cəhd edin.";
    static final String MSG_EMBEDDING_UNAVAILABLE =
        "Semantik axtarış hazırda əlçatan deyil. Yalnız filtrlərlə axtarın və ya sonra yenidən cəhd edin.";

    private static final Comparator<IndexedDocument> BROWSE_ORDER = Comparator
        .comparing((IndexedDocument entry) -> entry.metadata().recency().orElse(null),
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(entry -> entry.metadata().isPartiallyAmbiguous())
        .thenComparing(IndexedDocument::documentId);

    private final VectorIndex vectorIndex;
    private final EmbeddingGateway embeddingGateway;
    private final CourtRagProperties properties;
    private final ExecutorService searchExecutor;
    private final SearchStatisticsService statisticsService;
    private final Clock clock;

    public HybridSearchService(VectorIndex vectorIndex,
                               EmbeddingGateway embeddingGateway,
                               CourtRagProperties properties,
                               @Qualifier("searchExecutor") ExecutorService searchExecutor,
                               SearchStatisticsService statisticsService,
                               Clock clock) {
        this.vectorIndex = vectorIndex;
        this.embeddingGateway = embeddingGateway;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
        this.statisticsService = statisticsService;
        this.clock = clock;
    }

    public SearchOutcome search(SearchQuery query) {
        SearchTimer timer = SearchTimer.start(clock);
        int limit = effectiveLimit(query.limit());

        log.debug("Search text='{}' filters={} limit={} offset={}", query.text(), query.filters(), limit, query.offset());

        Future<SearchOutcome> future = searchExecutor.submit(() -> execute(query, limit, timer));
        SearchOutcome outcome;
        TimingInfo timing;
        try {
            outcome = future.get(properties.getSearchTimeoutMillis(), TimeUnit.MILLISECONDS);
            timing = timer.toTimingInfo();
        } catch (TimeoutException e) {
            future.cancel(true);
            timer.end();
            // steps may still be written by the cancelled task, report the total only
            timing = TimingInfo.builder()
                .totalMillis(timer.getTotalMillis())
                .startedAt(timer.getStartedAt().toString())
                .build();
            outcome = outcome(SearchStatus.TIMEOUT, query, limit, MSG_TIMEOUT).build();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CourtRagException("Search interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CourtRagException("Search failed: " + cause.getMessage(), cause);
        }

        outcome.setTiming(timing);
        statisticsService.record(query.text(), outcome.getStatus(), timing);
        log.info("Search '{}' -> {} ({} of {} hits, {}ms)", query.text(), outcome.getStatus(),
            outcome.getHits().size(), outcome.getTotalMatches(), timing.getTotalMillis());
        return outcome;
    }

    SearchOutcome execute(SearchQuery query, int limit, SearchTimer timer) {
        List<IndexedDocument> candidates = vectorIndex.entries().stream()
            .filter(entry -> FilterMatcher.matchesAll(entry.metadata(), query.filters()))
            .collect(Collectors.toList());
        timer.mark("filter");

        if (candidates.isEmpty()) {
            return outcome(SearchStatus.NO_MATCHES, query, limit, MSG_NO_MATCHES).build();
        }

        List<SearchHit> ranked;
        if (!query.hasText()) {
            ranked = browse(candidates);
            timer.mark("browse");
        } else {
            float[] queryVector;
            try {
                queryVector = embeddingGateway.embed(query.text());
            } catch (EmbeddingException e) {
                log.warn("Query embedding failed: {}", e.getMessage());
                return outcome(SearchStatus.EMBEDDING_UNAVAILABLE, query, limit, MSG_EMBEDDING_UNAVAILABLE)
                    .totalMatches(candidates.size())
                    .build();
            }
            timer.mark("embedding");

            ranked = rank(candidates, queryVector);
            timer.mark("ranking");

            if (ranked.isEmpty()) {
                return outcome(SearchStatus.NO_SUFFICIENTLY_RELEVANT, query, limit, MSG_NOT_RELEVANT).build();
            }
        }

        int from = Math.min(query.offset(), ranked.size());
        int to = Math.min(from + limit, ranked.size());
        return outcome(SearchStatus.OK, query, limit, ranked.size() + " nəticə tapıldı.")
            .hits(new ArrayList<>(ranked.subList(from, to)))
            .totalMatches(ranked.size())
            .build();
    }

    private List<SearchHit> rank(List<IndexedDocument> candidates, float[] queryVector) {
        double minRelevance = properties.getMinRelevance();
        Map<String, ScoredChunk> best = new HashMap<>();

        for (IndexedDocument entry : candidates) {
            checkCancelled();
            for (DocumentChunk chunk : entry.chunks()) {
                double similarity = VectorMath.cosineSimilarity(queryVector, chunk.embedding());
                if (similarity < minRelevance) {
                    continue;
                }
                best.merge(entry.documentId(), new ScoredChunk(entry, chunk, similarity),
                    (kept, next) -> next.similarity() > kept.similarity() ? next : kept);
            }
        }

        double penalty = properties.getAmbiguityPenalty();
        return best.values().stream()
            .map(scored -> toHit(scored, penalty))
            .sorted(Comparator.comparingDouble(SearchHit::getScore).reversed()
                .thenComparing(SearchHit::getDocumentId))
            .collect(Collectors.toList());
    }

    private List<SearchHit> browse(List<IndexedDocument> candidates) {
        return candidates.stream()
            .sorted(BROWSE_ORDER)
            .map(entry -> {
                Optional<DocumentChunk> first = entry.chunks().stream()
                    .min(Comparator.comparingInt(DocumentChunk::sequence));
                return SearchHit.builder()
                    .documentId(entry.documentId())
                    .chunkId(first.map(DocumentChunk::id).orElse(null))
                    .excerpt(first.map(DocumentChunk::text).orElse(entry.excerpt()))
                    .metadata(entry.metadata().toView())
                    .score(1.0)
                    .similarity(0.0)
                    .sourceFilename(entry.sourceFilename())
                    .build();
            })
            .collect(Collectors.toList());
    }

    private SearchHit toHit(ScoredChunk scored, double penalty) {
        IndexedDocument entry = scored.entry();
        double score = scored.similarity() - (entry.metadata().isPartiallyAmbiguous() ? penalty : 0.0);
        return SearchHit.builder()
            .documentId(entry.documentId())
            .chunkId(scored.chunk().id())
            .excerpt(scored.chunk().text())
            .metadata(scored.chunk().metadata().toView())
            .score(score)
            .similarity(scored.similarity())
            .sourceFilename(entry.sourceFilename())
            .build();
    }

    private SearchOutcome.SearchOutcomeBuilder outcome(SearchStatus status, SearchQuery query, int limit, String message) {
        Map<String, String> filters = new LinkedHashMap<>();
        for (Map.Entry<MetadataField, String> filter : query.filters().entrySet()) {
            filters.put(filter.getKey().getKey(), filter.getValue());
        }
        return SearchOutcome.builder()
            .status(status)
            .queryText(query.text())
            .filters(filters)
            .offset(query.offset())
            .limit(limit)
            .message(message);
    }

    int effectiveLimit(Integer requested) {
        if (requested == null) {
            return properties.getDefaultLimit();
        }
        return Math.max(1, Math.min(requested, properties.getMaxLimit()));
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Search cancelled");
        }
    }

    private record ScoredChunk(IndexedDocument entry, DocumentChunk chunk, double similarity) {
    }
}
