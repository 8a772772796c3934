package com.courtrag.controller;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.courtrag.dto.request.DocumentSubmission;
import com.courtrag.dto.request.MetadataCorrectionRequest;
import com.courtrag.dto.response.DocumentView;
import com.courtrag.dto.response.IngestionReport;
import com.courtrag.model.MetadataField;
import com.courtrag.service.ingestion.IngestionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final IngestionService ingestionService;

    @PostMapping
    public ResponseEntity<IngestionReport> ingest(@Valid @RequestBody DocumentSubmission submission) {
        log.info("Document submitted: {}", submission.getFilename());
        IngestionReport report = ingestionService.ingest(submission);
        HttpStatus status = report.isReplacedExisting() || report.isSuperseded() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(report);
    }

    @PostMapping("/batch")
    public ResponseEntity<List<IngestionReport>> ingestBatch(@RequestBody List<DocumentSubmission> submissions) {
        log.info("Batch of {} documents submitted", submissions.size());
        return ResponseEntity.ok(ingestionService.ingestAll(submissions));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentView> get(@PathVariable String id) {
        return ResponseEntity.ok(ingestionService.view(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        ingestionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/metadata")
    public ResponseEntity<DocumentView> correctMetadata(@PathVariable String id,
                                                        @Valid @RequestBody MetadataCorrectionRequest request) {
        Map<MetadataField, String> corrections = new EnumMap<>(MetadataField.class);
        request.getCorrections().forEach((key, value) -> {
            MetadataField field = MetadataField.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metadata field: " + key));
            corrections.put(field, value == null ? "" : value);
        });
        log.info("Metadata correction for {}: {}", id, corrections.keySet());
        return ResponseEntity.ok(ingestionService.correctMetadata(id, corrections));
    }
}
