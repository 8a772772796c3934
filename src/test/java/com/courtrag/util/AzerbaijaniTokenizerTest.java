package com.courtrag.util;

import com.courtrag.util.AzerbaijaniTokenizer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AzerbaijaniTokenizerTest {

    private final AzerbaijaniTokenizer tokenizer = new AzerbaijaniTokenizer();

    @Test
    void shouldKeepCaseNumbersAndOrdinalYearsAsOneToken() {
        List<Token> tokens = tokenizer.tokenize("İş № 2(103)-1234/2023, 2025-ci il");

        assertEquals(List.of("İş", "2(103)-1234/2023", "2025-ci", "il"),
            tokens.stream().map(Token::surface).toList());
        assertTrue(tokens.get(1).hasDigit());
        assertFalse(tokens.get(1).isNumeric());
    }

    @Test
    void shouldMatchStemWithCaseEndings() {
        assertTrue(AzerbaijaniTokenizer.matchesStem("kamranin", "kamran"));
        assertTrue(AzerbaijaniTokenizer.matchesStem("mehkemesinin", "mehkemesi"));
        assertTrue(AzerbaijaniTokenizer.matchesStem("agdamda", "agdam"));
        assertTrue(AzerbaijaniTokenizer.matchesStem("kamran'in", "kamran"));
        assertFalse(AzerbaijaniTokenizer.matchesStem("kamranov", "kamran"));
    }

    @Test
    void shouldNotMistakeNamesForShortLabelWords() {
        assertTrue(AzerbaijaniTokenizer.matchesWord("ilde", "il"));
        assertFalse(AzerbaijaniTokenizer.matchesWord("ilkin", "il"));
        assertFalse(AzerbaijaniTokenizer.matchesWord("isa", "is"));
    }

    @Test
    void shouldTreatLabelWordsAsStopWords() {
        List<Token> tokens = tokenizer.tokenize("qərarları torpaq");

        assertTrue(tokenizer.isStopWord(tokens.get(0)));
        assertFalse(tokenizer.isStopWord(tokens.get(1)));
    }

    @Test
    void shouldExtractDistinctKeywords() {
        List<String> keywords = tokenizer.extractKeywords("Torpaq mübahisəsi və torpaq sahəsi haqqında qərar", 5);

        assertEquals(List.of("torpaq", "mubahisesi", "sahesi"), keywords);
    }
}
