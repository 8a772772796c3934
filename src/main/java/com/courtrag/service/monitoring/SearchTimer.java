package com.courtrag.service.monitoring;

import com.courtrag.dto.internal.TimingInfo;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Step timer for a single search. Not shared between threads: create one per
 * search with {@link #start(Clock)}.
 */
public final class SearchTimer {

    private final Instant startedAt;
    private final long startNanos;
    private final Map<String, Long> cumulativeMillis = new LinkedHashMap<>();
    private Long endNanos;

    private SearchTimer(Clock clock) {
        this.startedAt = clock.instant();
        this.startNanos = System.nanoTime();
    }

    public static SearchTimer start(Clock clock) {
        return new SearchTimer(clock);
    }

    /**
     * Record the end of a step.
     */
    public void mark(String stepName) {
        cumulativeMillis.put(stepName, elapsedMillis(System.nanoTime()));
    }

    public void end() {
        if (endNanos == null) {
            endNanos = System.nanoTime();
        }
    }

    public long getTotalMillis() {
        return elapsedMillis(endNanos != null ? endNanos : System.nanoTime());
    }

    /**
     * Durations of the individual steps, each measured from the previous mark.
     */
    public Map<String, Long> getStepDurations() {
        Map<String, Long> durations = new LinkedHashMap<>();

        long previous = 0L;
        for (Map.Entry<String, Long> entry : cumulativeMillis.entrySet()) {
            durations.put(entry.getKey(), entry.getValue() - previous);
            previous = entry.getValue();
        }

        return durations;
    }

    public TimingInfo toTimingInfo() {
        end();
        return TimingInfo.builder()
            .totalMillis(getTotalMillis())
            .stepMillis(getStepDurations())
            .startedAt(startedAt.toString())
            .build();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    private long elapsedMillis(long nowNanos) {
        return (nowNanos - startNanos) / 1_000_000L;
    }
}
