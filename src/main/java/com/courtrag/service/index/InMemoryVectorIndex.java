package com.courtrag.service.index;

import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, IndexedDocument> entries = new ConcurrentHashMap<>();

    @Override
    public PublishOutcome publish(IndexedDocument entry) {
        IndexedDocument[] previous = new IndexedDocument[1];
        boolean[] published = new boolean[1];

        entries.compute(entry.documentId(), (id, current) -> {
            previous[0] = current;
            if (current != null && current.sequence() > entry.sequence()) {
                return current;
            }
            published[0] = true;
            return entry;
        });

        if (published[0]) {
            log.debug("Published {} with {} chunks (seq {})", entry.documentId(), entry.chunks().size(), entry.sequence());
        } else {
            log.info("Discarded stale entry for {} (seq {} < live seq {})",
                entry.documentId(), entry.sequence(), previous[0].sequence());
        }
        return new PublishOutcome(published[0], Optional.ofNullable(previous[0]));
    }

    @Override
    public Optional<IndexedDocument> remove(String documentId) {
        return Optional.ofNullable(entries.remove(documentId));
    }

    @Override
    public Optional<IndexedDocument> find(String documentId) {
        return Optional.ofNullable(entries.get(documentId));
    }

    @Override
    public Optional<DocumentChunk> findChunk(String chunkId) {
        int hash = chunkId.lastIndexOf('#');
        if (hash <= 0) {
            return Optional.empty();
        }
        return find(chunkId.substring(0, hash))
            .flatMap(entry -> entry.chunks().stream()
                .filter(chunk -> chunk.id().equals(chunkId))
                .findFirst());
    }

    @Override
    public Collection<IndexedDocument> entries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int chunkCount() {
        return entries.values().stream().mapToInt(entry -> entry.chunks().size()).sum();
    }

    @Override
    public void clear() {
        entries.clear();
    }
}
