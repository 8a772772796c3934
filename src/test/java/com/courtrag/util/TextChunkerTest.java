package com.courtrag.util;

import com.courtrag.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker(200, 40, 20);

    @Test
    void shouldReturnSingleChunkForShortText() {
        List<String> chunks = chunker.chunk("Qısa qərar mətni.");

        assertEquals(List.of("Qısa qərar mətni."), chunks);
    }

    @Test
    void shouldReturnOneEmptyChunkForBlankText() {
        assertEquals(List.of(""), chunker.chunk("   "));
    }

    @Test
    void shouldRespectMaximumLengthAndOverlap() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            text.append("Cümlə nömrə ").append(i).append(" məhkəmə iclasının gedişini təsvir edir. ");
            if (i % 7 == 6) {
                text.append("\n\n");
            }
        }

        List<String> chunks = chunker.chunk(text.toString().strip());

        assertTrue(chunks.size() > 1);
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            assertTrue(chunk.length() <= 200, "chunk " + i + " too long: " + chunk.length());
            if (i > 0) {
                String previous = chunks.get(i - 1);
                String overlap = chunk.substring(0, 20);
                assertTrue(previous.contains(overlap), "chunk " + i + " does not overlap its predecessor");
            }
        }
    }

    @Test
    void shouldSplitOverlongWords() {
        List<String> chunks = chunker.chunk("a".repeat(450));

        assertEquals(3, chunks.size());
        assertEquals("a".repeat(159), chunks.get(0));
        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= 200));
    }

    @Test
    void shouldTruncateWithEllipsis() {
        assertEquals("Məhkəmə...", TextChunker.truncate("Məhkəmə qərarı", 8));
        assertEquals("qısa", TextChunker.truncate("qısa", 8));
    }

    @Test
    void shouldRejectInconsistentSettings() {
        assertThrows(InvalidConfigurationException.class, () -> new TextChunker(100, 60, 20));
        assertThrows(InvalidConfigurationException.class, () -> new TextChunker(200, 40, 50));
        assertThrows(InvalidConfigurationException.class, () -> new TextChunker(200, 40, 0));
    }
}
