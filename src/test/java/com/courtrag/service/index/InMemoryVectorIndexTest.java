package com.courtrag.service.index;

import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;
import com.courtrag.model.MetadataRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorIndexTest {

    private final InMemoryVectorIndex index = new InMemoryVectorIndex();

    private static IndexedDocument entry(String id, long sequence, int chunks) {
        List<DocumentChunk> list = new ArrayList<>();
        for (int i = 0; i < chunks; i++) {
            list.add(DocumentChunk.of(id, i, "mətn " + i, new float[] {1f, 0f}, MetadataRecord.empty()));
        }
        return new IndexedDocument(id, MetadataRecord.empty(), id + ".pdf", Instant.EPOCH, sequence, "mətn", list);
    }

    @Test
    void shouldReplaceOlderEntryAtomically() {
        index.publish(entry("doc_a", 1, 3));

        VectorIndex.PublishOutcome outcome = index.publish(entry("doc_a", 2, 1));

        assertTrue(outcome.published());
        assertEquals(3, outcome.previous().orElseThrow().chunks().size());
        assertEquals(1, index.size());
        assertEquals(1, index.chunkCount());
    }

    @Test
    void shouldDiscardStaleEntry() {
        index.publish(entry("doc_a", 5, 2));

        VectorIndex.PublishOutcome outcome = index.publish(entry("doc_a", 4, 1));

        assertFalse(outcome.published());
        assertEquals(5, index.find("doc_a").orElseThrow().sequence());
    }

    @Test
    void shouldFindChunkById() {
        index.publish(entry("doc_a#x", 1, 2));

        DocumentChunk chunk = index.findChunk("doc_a#x#1").orElseThrow();

        assertEquals("mətn 1", chunk.text());
        assertTrue(index.findChunk("missing#0").isEmpty());
        assertTrue(index.findChunk("no-separator").isEmpty());
    }

    @Test
    void shouldKeepEntriesWithoutChunks() {
        index.publish(entry("doc_empty", 1, 0));

        assertTrue(index.find("doc_empty").isPresent());
        assertEquals(0, index.chunkCount());
    }

    @Test
    void shouldRemoveAndClear() {
        index.publish(entry("doc_a", 1, 1));
        index.publish(entry("doc_b", 1, 1));

        assertTrue(index.remove("doc_a").isPresent());
        assertTrue(index.remove("doc_a").isEmpty());

        index.clear();
        assertEquals(0, index.size());
    }
}
