package com.courtrag.service.data;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.dto.request.DocumentSubmission;
import com.courtrag.dto.response.IngestionReport;
import com.courtrag.exception.CourtRagException;
import com.courtrag.service.ingestion.IngestionService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Bulk intake of a corpus file: a JSON array of {@code {id?, filename, text}}
 * objects whose text was already extracted from the source documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusLoaderService {

    private final CourtRagProperties properties;
    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;

    public Map<String, Object> loadConfiguredCorpus() {
        String corpusPath = properties.getIngestion().getCorpusPath();
        if (corpusPath == null || corpusPath.isBlank()) {
            throw new IllegalArgumentException("court-rag.ingestion.corpus-path is not set");
        }
        return loadCorpus(Paths.get(corpusPath));
    }

    public Map<String, Object> loadCorpus(Path corpusPath) {
        Path path = corpusPath.toAbsolutePath();
        log.info("Loading corpus from: {}", path);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Corpus file not found: " + path);
        }

        List<DocumentSubmission> submissions = read(path);
        List<IngestionReport> reports = ingestionService.ingestAll(submissions);

        int failed = 0;
        int chunks = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (IngestionReport report : reports) {
            if (report.isFailed()) {
                failed++;
                errors.add(report.getSourceFilename() + ": " + report.getError());
            } else {
                chunks += report.getIndexedChunks();
                skipped += report.getSkippedChunks();
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("corpusPath", path.toString());
        summary.put("documents", submissions.size());
        summary.put("ingested", submissions.size() - failed);
        summary.put("failed", failed);
        summary.put("indexedChunks", chunks);
        summary.put("skippedChunks", skipped);
        summary.put("errors", errors);

        log.info("Corpus loaded: {} documents, {} failed, {} chunks indexed, {} skipped",
            submissions.size(), failed, chunks, skipped);
        return summary;
    }

    private List<DocumentSubmission> read(Path path) {
        List<Map<String, Object>> raw;
        try {
            raw = objectMapper.readValue(Files.readString(path), new TypeReference<List<Map<String, Object>>>() {
            });
        } catch (IOException e) {
            throw new CourtRagException("Failed to read corpus " + path + ": " + e.getMessage(), e);
        }

        List<DocumentSubmission> submissions = new ArrayList<>();
        for (int i = 0; i < raw.size(); i++) {
            Map<String, Object> item = raw.get(i);
            Object text = item.get("text");
            if (text == null || String.valueOf(text).isBlank()) {
                log.warn("Corpus entry {} has no text, skipping", i);
                continue;
            }
            submissions.add(DocumentSubmission.builder()
                .id(stringOrNull(item.get("id")))
                .filename(stringOrNull(item.get("filename")))
                .text(String.valueOf(text))
                .build());
        }
        return submissions;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
