package com.courtrag.dto.response;

import com.courtrag.dto.internal.TimingInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchOutcome {

    private SearchStatus status;

    private String queryText;

    @Builder.Default
    private Map<String, String> filters = new LinkedHashMap<>();

    @Builder.Default
    private List<SearchHit> hits = new ArrayList<>();

    /** Ranked documents before paging. */
    private int totalMatches;

    private int offset;

    private int limit;

    // ================= AMBIGUITY =================
    /**
     * A clarification was abandoned and one candidate was guessed.
     */
    private boolean bestEffort;

    private String unresolvedField;

    @Builder.Default
    private List<String> unresolvedCandidates = new ArrayList<>();

    private TimingInfo timing;

    /** Human-readable explanation in Azerbaijani. */
    private String message;
}
