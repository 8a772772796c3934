package com.courtrag.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

/**
 * Wall-clock breakdown of one search, in milliseconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimingInfo {

    private long totalMillis;

    /** Step name to its own duration, in execution order. */
    @Builder.Default
    private Map<String, Long> stepMillis = new LinkedHashMap<>();

    private String startedAt;
}
