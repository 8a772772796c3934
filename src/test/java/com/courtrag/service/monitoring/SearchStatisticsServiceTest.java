package com.courtrag.service.monitoring;

import com.courtrag.dto.internal.TimingInfo;
import com.courtrag.dto.response.SearchStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchStatisticsServiceTest {

    private static TimingInfo timing(long total, long embedding) {
        TimingInfo timing = TimingInfo.builder()
            .totalMillis(total)
            .startedAt("2025-01-01T00:00:00Z")
            .build();
        timing.getStepMillis().put("query_embedding", embedding);
        return timing;
    }

    @Test
    void shouldCountOutcomes() {
        SearchStatisticsService service = new SearchStatisticsService(10);

        service.record("torpaq", SearchStatus.OK, timing(10, 4));
        service.record("torpaq", SearchStatus.OK, timing(20, 6));
        service.record("aliment", SearchStatus.NO_MATCHES, timing(5, 2));

        assertEquals(2, service.count(SearchStatus.OK));
        assertEquals(1, service.count(SearchStatus.NO_MATCHES));
        assertEquals(0, service.count(SearchStatus.TIMEOUT));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSummarizeLatencies() {
        SearchStatisticsService service = new SearchStatisticsService(10);
        service.record("a", SearchStatus.OK, timing(10, 4));
        service.record("b", SearchStatus.OK, timing(30, 8));
        service.record("c", SearchStatus.OK, timing(20, 6));

        Map<String, Object> stats = service.getStatistics();

        assertEquals(3, stats.get("recentSearches"));
        Map<String, Double> latency = (Map<String, Double>) stats.get("latencyMillis");
        assertEquals(20.0, latency.get("avg"));
        assertEquals(20.0, latency.get("median"));
        assertEquals(10.0, latency.get("min"));
        assertEquals(30.0, latency.get("max"));

        Map<String, Map<String, Double>> steps = (Map<String, Map<String, Double>>) stats.get("stepStatistics");
        assertEquals(6.0, steps.get("query_embedding").get("median"));
    }

    @Test
    void shouldKeepOnlyRecentHistory() {
        SearchStatisticsService service = new SearchStatisticsService(2);
        for (int i = 0; i < 5; i++) {
            service.record("q" + i, SearchStatus.OK, timing(i, 0));
        }

        assertEquals(2, service.getStatistics().get("recentSearches"));
        assertEquals(5, service.count(SearchStatus.OK));
    }

    @Test
    void shouldReportOnlyOutcomesWhenEmpty() {
        Map<String, Object> stats = new SearchStatisticsService(10).getStatistics();

        assertEquals(0, stats.get("recentSearches"));
        assertFalse(stats.containsKey("latencyMillis"));
    }
}
