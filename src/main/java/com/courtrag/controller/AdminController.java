package com.courtrag.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.courtrag.service.data.CorpusLoaderService;
import com.courtrag.service.ingestion.IngestionService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final CorpusLoaderService corpusLoaderService;
    private final IngestionService ingestionService;

    @PostMapping("/load-corpus")
    public ResponseEntity<Map<String, Object>> loadCorpus() {
        return ResponseEntity.ok(corpusLoaderService.loadConfiguredCorpus());
    }

    @PostMapping("/reindex")
    public ResponseEntity<Map<String, Object>> reindex() {
        return ResponseEntity.ok(ingestionService.reindex());
    }
}
