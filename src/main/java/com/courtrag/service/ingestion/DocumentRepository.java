package com.courtrag.service.ingestion;

import com.courtrag.model.CourtDocument;

import java.util.*;

/**
 * Owner of ingested documents. Index entries refer to documents by id only.
 */
public interface DocumentRepository {

    void save(CourtDocument document);

    Optional<CourtDocument> findById(String id);

    Optional<CourtDocument> deleteById(String id);

    Collection<CourtDocument> findAll();

    int count();
}
