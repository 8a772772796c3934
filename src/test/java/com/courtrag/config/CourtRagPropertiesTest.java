package com.courtrag.config;

import org.junit.jupiter.api.Test;

import com.courtrag.exception.InvalidConfigurationException;
import com.courtrag.service.dialogue.CandidatePriority;

import static org.junit.jupiter.api.Assertions.*;

class CourtRagPropertiesTest {

    @Test
    void shouldFallBackToDefaults() {
        CourtRagProperties properties = new CourtRagProperties();

        assertEquals(1000, properties.getMaxChunkChars());
        assertEquals(150, properties.getOverlapChars());
        assertEquals(100, properties.getMinOverlapChars());
        assertEquals(10, properties.getDefaultLimit());
        assertEquals(2, properties.getMaxClarificationRounds());
        assertEquals(CandidatePriority.DOCUMENT_COUNT, properties.getCandidatePriority());
        assertFalse(properties.isLoadOnStartup());
        assertDoesNotThrow(properties::validate);
    }

    @Test
    void shouldRejectOverlapOfHalfTheChunk() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getChunking().setMaxChars(300);
        properties.getChunking().setOverlapChars(150);

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);
        assertTrue(ex.getMessage().contains("Invalid chunking"));
    }

    @Test
    void shouldRejectMinimumOverlapAboveOverlap() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getChunking().setMinOverlapChars(200);

        assertThrows(InvalidConfigurationException.class, properties::validate);
    }

    @Test
    void shouldRejectDefaultLimitAboveMaximum() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getSearch().setDefaultLimit(50);
        properties.getSearch().setMaxLimit(20);

        assertThrows(InvalidConfigurationException.class, properties::validate);
    }

    @Test
    void shouldRejectSingleCandidateAmbiguity() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getDialogue().setAmbiguityMinCandidates(1);

        assertThrows(InvalidConfigurationException.class, properties::validate);
    }

    @Test
    void shouldRejectZeroClarificationRounds() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getDialogue().setMaxClarificationRounds(0);

        assertThrows(InvalidConfigurationException.class, properties::validate);
    }
}
