package com.courtrag.service.monitoring;

import com.courtrag.dto.internal.TimingInfo;
import com.courtrag.dto.response.SearchStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Outcome counts and latency statistics over the most recent searches.
 */
@Slf4j
@Service
public class SearchStatisticsService {

    private final int maxQueryHistory;

    private final Deque<SearchRecord> history = new ConcurrentLinkedDeque<>();

    private final Map<SearchStatus, AtomicLong> outcomeCounts = new EnumMap<>(SearchStatus.class);

    public SearchStatisticsService(@Value("${court-rag.monitoring.max-query-history:100}") int maxQueryHistory) {
        this.maxQueryHistory = Math.max(1, maxQueryHistory);
        for (SearchStatus status : SearchStatus.values()) {
            outcomeCounts.put(status, new AtomicLong());
        }
    }

    public void record(String query, SearchStatus status, TimingInfo timing) {
        outcomeCounts.get(status).incrementAndGet();

        String shortQuery = query == null ? "" : (query.length() > 100 ? query.substring(0, 100) + "..." : query);
        history.addLast(new SearchRecord(timing.getStartedAt(), shortQuery, status,
            timing.getTotalMillis(), timing.getStepMillis()));

        // Keep only recent N searches
        while (history.size() > maxQueryHistory) {
            history.pollFirst();
        }

        if (status == SearchStatus.TIMEOUT) {
            log.warn("Search timed out after {}ms: '{}'", timing.getTotalMillis(), shortQuery);
        }
    }

    public long count(SearchStatus status) {
        return outcomeCounts.get(status).get();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();

        Map<String, Long> outcomes = new LinkedHashMap<>();
        outcomeCounts.forEach((status, count) -> outcomes.put(status.name(), count.get()));
        stats.put("outcomes", outcomes);

        List<SearchRecord> recent = new ArrayList<>(history);
        stats.put("recentSearches", recent.size());
        if (recent.isEmpty()) {
            return stats;
        }

        List<Long> totalTimes = recent.stream()
            .map(SearchRecord::totalMillis)
            .collect(Collectors.toList());
        stats.put("latencyMillis", summarize(totalTimes));

        // Aggregate step times
        Map<String, List<Long>> allSteps = new HashMap<>();
        for (SearchRecord record : recent) {
            for (Map.Entry<String, Long> entry : record.stepMillis().entrySet()) {
                allSteps.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                    .add(entry.getValue());
            }
        }

        Map<String, Map<String, Double>> stepStats = new LinkedHashMap<>();
        allSteps.forEach((step, times) -> stepStats.put(step, summarize(times)));
        stats.put("stepStatistics", stepStats);

        return stats;
    }

    private static Map<String, Double> summarize(List<Long> values) {
        Map<String, Double> summary = new LinkedHashMap<>();
        summary.put("avg", values.stream().mapToLong(Long::longValue).average().orElse(0.0));
        summary.put("median", median(values));
        summary.put("min", (double) Collections.min(values));
        summary.put("max", (double) Collections.max(values));
        return summary;
    }

    private static double median(List<Long> values) {
        List<Long> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int size = sorted.size();
        if (size % 2 == 0) {
            return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
        }
        return sorted.get(size / 2);
    }

    public record SearchRecord(
        String timestamp,
        String query,
        SearchStatus status,
        long totalMillis,
        Map<String, Long> stepMillis
    ) {
    }
}
