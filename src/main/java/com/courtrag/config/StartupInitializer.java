package com.courtrag.config;

import java.util.Map;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.courtrag.service.data.CorpusLoaderService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final CourtRagProperties properties;
    private final CorpusLoaderService corpusLoaderService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isLoadOnStartup()) {
            log.info("Corpus loading on startup disabled, index starts empty");
            return;
        }

        log.info("\n{}", "=".repeat(70));
        log.info("LOADING COURT RULINGS CORPUS");
        log.info("{}\n", "=".repeat(70));

        try {
            Map<String, Object> summary = corpusLoaderService.loadConfiguredCorpus();

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY ({} documents ingested)", summary.get("ingested"));
            log.info("{}\n", "=".repeat(70));

        } catch (RuntimeException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("CORPUS LOADING FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started with an empty index; use POST /api/admin/load-corpus to retry");
        }
    }
}
