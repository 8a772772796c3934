package com.courtrag.service.index;

import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;

import java.util.*;

/**
 * Published index entries keyed by document id. An entry is replaced whole;
 * readers see either the previous chunk set of a document or the new one.
 */
public interface VectorIndex {

    /**
     * Publish an entry unless one with a higher sequence is already live.
     */
    PublishOutcome publish(IndexedDocument entry);

    Optional<IndexedDocument> remove(String documentId);

    Optional<IndexedDocument> find(String documentId);

    Optional<DocumentChunk> findChunk(String chunkId);

    /**
     * Point-in-time copy of all live entries.
     */
    Collection<IndexedDocument> entries();

    int size();

    int chunkCount();

    void clear();

    /**
     * @param published whether the entry is now live
     * @param previous  the entry it replaced, or the newer live entry that won
     */
    record PublishOutcome(boolean published, Optional<IndexedDocument> previous) {
    }
}
