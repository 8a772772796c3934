package com.courtrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private String documentId;

    /** Null for metadata-only documents found by filter browsing. */
    private String chunkId;

    private String excerpt;

    private Map<String, Object> metadata;

    /** Composite score: similarity minus the ambiguity penalty. */
    private double score;

    private double similarity;

    private String sourceFilename;
}
