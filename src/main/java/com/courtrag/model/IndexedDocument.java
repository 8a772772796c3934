package com.courtrag.model;

import java.time.Instant;
import java.util.List;

/**
 * Unit of publication into the vector index: every embedded chunk of one
 * document plus the metadata snapshot they were indexed with. An entry with no
 * chunks is still published so the document stays reachable through filters.
 */
public record IndexedDocument(
        String documentId,
        MetadataRecord metadata,
        String sourceFilename,
        Instant ingestedAt,
        long sequence,
        String excerpt,
        List<DocumentChunk> chunks
) {

    public IndexedDocument {
        chunks = List.copyOf(chunks);
    }

    /**
     * Copy carrying a new metadata snapshot on the entry and on every chunk.
     * The sequence stays that of the ingestion that produced the chunks.
     */
    public IndexedDocument withMetadata(MetadataRecord snapshot) {
        List<DocumentChunk> restamped = chunks.stream()
                .map(chunk -> chunk.withMetadata(snapshot))
                .toList();
        return new IndexedDocument(documentId, snapshot, sourceFilename, ingestedAt, sequence, excerpt, restamped);
    }
}
