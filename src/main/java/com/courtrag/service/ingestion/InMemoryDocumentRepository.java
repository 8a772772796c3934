package com.courtrag.service.ingestion;

import com.courtrag.model.CourtDocument;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, CourtDocument> documents = new ConcurrentHashMap<>();

    @Override
    public void save(CourtDocument document) {
        documents.put(document.getId(), document);
    }

    @Override
    public Optional<CourtDocument> findById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public Optional<CourtDocument> deleteById(String id) {
        return Optional.ofNullable(documents.remove(id));
    }

    @Override
    public Collection<CourtDocument> findAll() {
        return new ArrayList<>(documents.values());
    }

    @Override
    public int count() {
        return documents.size();
    }
}
