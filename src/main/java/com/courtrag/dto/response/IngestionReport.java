package com.courtrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {

    private String documentId;

    private String sourceFilename;

    private int indexedChunks;

    private int skippedChunks;

    private int totalChunks;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private Map<String, Object> metadata;

    /**
     * A newer ingestion of the same id was already live, so this one was discarded.
     */
    private boolean superseded;

    /**
     * Whether this ingestion replaced an earlier live entry of the same id.
     */
    private boolean replacedExisting;

    /** Set only when the document could not be ingested at all. */
    private String error;

    public boolean isFailed() {
        return error != null;
    }
}
