package com.courtrag.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Component
public class AzerbaijaniTokenizer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['’\\-/.()]+[\\p{L}\\p{N}]+)*");

    private static final Set<String> STOP_WORDS = Set.of(
        "və", "ilə", "üçün", "bu", "o", "da", "də", "ki", "bir", "olan",
        "olunan", "haqqında", "barədə", "üzrə", "görə", "kimi", "hansı", "nə",
        "mən", "mənə", "bizə", "zəhmət", "olmasa", "göstər", "göstərin", "tap",
        "tapın", "axtar", "axtarın", "siyahı", "siyahısı", "bütün", "hamısı",
        "edən", "etmiş", "verən", "vermiş", "çıxarmış", "çıxarılmış", "olub",
        "var", "yoxdur", "ya", "yaxud", "və ya", "is", "the", "of"
    );

    /**
     * Label words that describe a field rather than carry content; matched with
     * any inflection.
     */
    private static final List<String> LABEL_STEMS = List.of(
        "qərar", "qətnamə", "qərarnamə", "hökm", "iş", "sənəd", "hakim",
        "məhkəmə", "il", "ildə", "rayon", "şəhər", "akt", "tarix", "növ"
    );

    /**
     * Case, possessive and plural endings, longest first, already OCR-folded.
     */
    private static final List<String> SUFFIXES = List.of(
        "ları", "ləri", "dakı", "dəki", "ndan", "ndən", "nın", "nin", "nun", "nün",
        "dan", "dən", "tan", "tən", "lar", "lər", "yla", "ylə", "ın", "in", "un", "ün",
        "ya", "yə", "da", "də", "ta", "tə", "la", "lə", "nı", "ni", "nu", "nü",
        "na", "nə", "sı", "si", "su", "sü", "cü", "cu", "ci", "cı", "ki",
        "ı", "i", "u", "ü", "a", "ə", "n"
    ).stream()
        .map(TextNormalizer::foldOcr)
        .distinct()
        .sorted(Comparator.comparingInt(String::length).reversed())
        .collect(Collectors.toList());

    private static final int MAX_SUFFIX_CHAIN = 3;

    private static final Set<String> SHORT_STEM_ENDINGS = Set.of(
        "", "i", "in", "e", "de", "da", "den", "dan", "ler", "lar", "leri", "lari", "lerin", "larin");

    /**
     * Split text into word tokens with their character offsets.
     */
    public List<Token> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String surface = matcher.group();
            tokens.add(new Token(surface, TextNormalizer.foldOcr(surface), matcher.start(), matcher.end()));
        }
        return tokens;
    }

    /**
     * Folded content words: stop-words, label words and one-letter tokens removed.
     */
    public List<String> contentWords(String text) {
        return tokenize(text).stream()
            .filter(token -> !isStopWord(token))
            .map(Token::folded)
            .filter(word -> word.length() > 1)
            .collect(Collectors.toList());
    }

    /**
     * Extract distinct keywords of at least three letters.
     */
    public List<String> extractKeywords(String text, int maxKeywords) {
        return contentWords(text).stream()
            .filter(word -> word.length() >= 3)
            .distinct()
            .limit(maxKeywords)
            .collect(Collectors.toList());
    }

    public boolean isStopWord(Token token) {
        String plain = TextNormalizer.fold(token.surface());
        if (STOP_WORDS.contains(plain)) {
            return true;
        }
        for (String stem : LABEL_STEMS) {
            if (matchesWord(token.folded(), TextNormalizer.foldOcr(stem))) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when {@code word} is {@code stem} followed by nothing or by a chain of
     * grammatical endings, e.g. {@code Kamranın} for {@code Kamran}. Both
     * arguments must be OCR-folded.
     */
    public static boolean matchesStem(String word, String stem) {
        if (stem.isEmpty() || !word.startsWith(stem)) {
            return false;
        }
        String rest = word.substring(stem.length());
        rest = rest.startsWith("'") || rest.startsWith("’") || rest.startsWith("-") ? rest.substring(1) : rest;
        return isSuffixChain(rest, MAX_SUFFIX_CHAIN);
    }

    /**
     * {@link #matchesStem} for stems of four letters or more; shorter stems such
     * as {@code il} or {@code is} only take a handful of common endings so that
     * names like {@code İlkin} or {@code İsa} are not mistaken for them.
     */
    public static boolean matchesWord(String word, String stem) {
        if (stem.length() >= 4) {
            return matchesStem(word, stem);
        }
        return word.startsWith(stem) && SHORT_STEM_ENDINGS.contains(word.substring(stem.length()));
    }

    private static boolean isSuffixChain(String rest, int depth) {
        if (rest.isEmpty()) {
            return true;
        }
        if (depth == 0) {
            return false;
        }
        for (String suffix : SUFFIXES) {
            if (rest.startsWith(suffix) && isSuffixChain(rest.substring(suffix.length()), depth - 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Word token with its surface form, OCR-folded form and offsets.
     */
    public record Token(String surface, String folded, int start, int end) {

        public boolean isNumeric() {
            return surface.chars().allMatch(Character::isDigit);
        }

        public boolean hasDigit() {
            return surface.chars().anyMatch(Character::isDigit);
        }
    }
}
