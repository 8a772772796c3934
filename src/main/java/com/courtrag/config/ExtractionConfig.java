package com.courtrag.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.courtrag.service.extraction.InstitutionCatalog;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class ExtractionConfig {

    @Bean
    public InstitutionCatalog institutionCatalog(CourtRagProperties properties) {
        InstitutionCatalog catalog = new InstitutionCatalog(
            properties.getExtraction().getKnownCourts(),
            properties.getExtraction().getKnownDistricts());
        log.info("Institution catalog: {} courts, {} districts",
            catalog.getCourts().size(), catalog.getDistricts().size());
        return catalog;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
