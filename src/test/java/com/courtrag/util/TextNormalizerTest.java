package com.courtrag.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void shouldCollapseSpacesAndKeepParagraphBreaks() {
        String raw = "  QƏRAR \t  Ağdam  \r\n\r\n\r\n\r\nHakim:   Əli Məmmədov  \n";

        assertEquals("QƏRAR Ağdam\n\nHakim: Əli Məmmədov", normalizer.normalize(raw));
    }

    @Test
    void shouldDropFormatCharacters() {
        assertEquals("Məhkəmə", normalizer.normalize("Məh\u200Bkə\u00ADmə"));
    }

    @Test
    void shouldReturnEmptyForNullOrEmpty() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
    }

    @Test
    void shouldFoldWithAzerbaijaniCasing() {
        assertEquals("ilkin ısmayılov", TextNormalizer.fold("İLKİN  ISMAYILOV"));
    }

    @Test
    void shouldFoldOcrVariantsToPlainLetters() {
        assertEquals("sirvan apellyasiya mehkemesi", TextNormalizer.foldOcr("Şirvan Apellyasiya Məhkəməsi"));
        assertEquals(TextNormalizer.foldOcr("Ağdam"), TextNormalizer.foldOcr("AGDAM"));
    }

    @Test
    void shouldBuildCatalogKeyWithoutPunctuation() {
        assertEquals("baki kommersiya mehkemesi",
            TextNormalizer.catalogKey("Bakı   Kommersiya-Məhkəməsi."));
    }
}
