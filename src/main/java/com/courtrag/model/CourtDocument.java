package com.courtrag.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An ingested ruling. Only the metadata may change after ingestion, and a
 * correction produces a new instance.
 */
@Value
@Builder(toBuilder = true)
public class CourtDocument {

    String id;

    String rawText;

    String normalizedText;

    MetadataRecord metadata;

    Instant ingestedAt;

    String sourceFilename;

    public CourtDocument withMetadata(MetadataRecord corrected) {
        return toBuilder().metadata(corrected).build();
    }
}
