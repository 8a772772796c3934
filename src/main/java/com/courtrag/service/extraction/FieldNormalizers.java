package com.courtrag.service.extraction;

import com.courtrag.model.DecisionType;
import com.courtrag.util.AzerbaijaniTokenizer;
import com.courtrag.util.TextNormalizer;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw captures into canonical field values, or rejects them.
 */
class FieldNormalizers {

    static final int MIN_YEAR = 1900;

    private static final Pattern EDGE_NOISE = Pattern.compile("^[\\s:;,.\\-–—]+|[\\s:;,\\-–—]+$");
    private static final Pattern NAME_TOKEN = Pattern.compile("\\p{Lu}[\\p{L}'’\\-]*\\.?");
    private static final Pattern GENITIVE_SURNAME = Pattern.compile("(ov|ova|ev|eva|yev|yeva|li|lı|lu|lü)(un|ün|in|ın|nın|nin|nun|nün)$");
    private static final Pattern CASE_NUMBER = Pattern.compile("\\d[\\p{L}\\d()\\-/.]*");
    private static final Pattern FOUR_DIGITS = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern COURT_WORD = Pattern.compile(AnchorPatterns.anchor("Məhkəməsi", false));

    private static final Pattern DATE_DMY = Pattern.compile(
        "(?<!\\d)(\\d{1,2})(?:\\s*[./]\\s*|\\s+)(\\d{1,2})(?:\\s*[./]\\s*|\\s+)(\\d{4})(?!\\d)");
    private static final Pattern DATE_ISO = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");
    private static final Pattern DATE_MONTH_NAME = Pattern.compile("(?<!\\d)(\\d{1,2})\\s+(\\p{L}+)\\s+(\\d{4})(?!\\d)");

    private static final List<String> MONTHS = List.of(
        "yanvar", "fevral", "mart", "aprel", "may", "iyun",
        "iyul", "avqust", "sentyabr", "oktyabr", "noyabr", "dekabr");

    private static final List<String> NAME_BREAKERS = List.of(
        "məhkəmə", "azərbaycan", "respublika", "rayon", "şəhər", "iclas", "qərar",
        "qətnamə", "iş", "hakim", "katib", "tarix", "il", "iddiaçı", "cavabdeh");

    private static final Map<String, String> CASE_TYPES = new LinkedHashMap<>();

    static {
        CASE_TYPES.put("inzibati xeta", "İnzibati xəta");
        CASE_TYPES.put("inzibati", "İnzibati");
        CASE_TYPES.put("mulki", "Mülki");
        CASE_TYPES.put("kommersiya", "Kommersiya");
        CASE_TYPES.put("iqtisadi", "Kommersiya");
        CASE_TYPES.put("cinayet", "Cinayət");
    }

    private final InstitutionCatalog catalog;
    private final Clock clock;

    FieldNormalizers(InstitutionCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return EDGE_NOISE.matcher(TextNormalizer.collapseWhitespace(raw)).replaceAll("");
    }

    Optional<String> courtName(String raw) {
        String value = clean(raw);
        Matcher matcher = COURT_WORD.matcher(value);
        if (matcher.find()) {
            int end = matcher.end();
            while (end < value.length() && Character.isLetter(value.charAt(end))) {
                end++;
            }
            value = value.substring(0, end);
        }
        if (value.length() < 4 || !Character.isLetter(value.charAt(0))) {
            return Optional.empty();
        }
        return Optional.of(catalog.canonicalCourt(value));
    }

    Optional<String> district(String raw) {
        String value = clean(raw);
        List<String> words = new ArrayList<>();
        for (String word : value.split(" ")) {
            if (word.isEmpty() || !Character.isLetter(word.charAt(0)) || words.size() == 3) {
                break;
            }
            words.add(word.replaceAll("[,.]+$", ""));
        }
        if (words.isEmpty() || !Character.isUpperCase(words.get(0).charAt(0))) {
            return Optional.empty();
        }
        return Optional.of(catalog.canonicalDistrict(String.join(" ", words)));
    }

    /**
     * Leading run of capitalized words, at most four, with a genitive ending
     * removed from a trailing surname. Words typed entirely in capitals are
     * title-cased.
     */
    Optional<String> personName(String raw) {
        String value = clean(raw);
        List<String> tokens = new ArrayList<>();
        for (String word : value.split(" ")) {
            if (tokens.size() == 4 || !NAME_TOKEN.matcher(word).matches() || breaksName(word)) {
                break;
            }
            tokens.add(titleCase(word));
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }

        int last = tokens.size() - 1;
        String surname = tokens.get(last);
        Matcher genitive = GENITIVE_SURNAME.matcher(surname);
        if (tokens.size() > 1 && genitive.find()) {
            tokens.set(last, surname.substring(0, genitive.start(2)));
        }

        String name = String.join(" ", tokens);
        return name.length() < 2 ? Optional.empty() : Optional.of(name);
    }

    private static String titleCase(String word) {
        if (word.length() < 2 || !word.equals(word.toUpperCase(TextNormalizer.AZERBAIJANI))) {
            return word;
        }
        return word.substring(0, 1) + word.substring(1).toLowerCase(TextNormalizer.AZERBAIJANI);
    }

    Optional<String> party(String raw) {
        String value = clean(raw);
        int comma = value.indexOf(',');
        if (comma > 0) {
            value = value.substring(0, comma).strip();
        }
        if (value.length() <= 3) {
            return Optional.empty();
        }
        return Optional.of(value.length() > 120 ? value.substring(0, 120).strip() : value);
    }

    Optional<String> caseNumber(String raw) {
        Matcher matcher = CASE_NUMBER.matcher(clean(raw));
        if (!matcher.find()) {
            return Optional.empty();
        }
        String number = matcher.group().replaceAll("[.\\-/]+$", "");
        return number.isEmpty() ? Optional.empty() : Optional.of(number);
    }

    Optional<String> caseType(String raw) {
        String value = clean(raw);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        String folded = TextNormalizer.foldOcr(value);
        for (Map.Entry<String, String> entry : CASE_TYPES.entrySet()) {
            if (folded.startsWith(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return value.length() > 60 ? Optional.empty() : Optional.of(value);
    }

    Optional<String> decisionType(String raw) {
        return DecisionType.fromText(clean(raw)).map(DecisionType::getLabel);
    }

    Optional<String> year(String raw) {
        Matcher matcher = FOUR_DIGITS.matcher(raw == null ? "" : raw);
        while (matcher.find()) {
            int year = Integer.parseInt(matcher.group(1));
            if (isPlausibleYear(year)) {
                return Optional.of(String.valueOf(year));
            }
        }
        return Optional.empty();
    }

    /**
     * Earliest valid calendar date in the string, as ISO {@code yyyy-MM-dd}.
     */
    Optional<String> date(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        List<PositionedDate> found = new ArrayList<>();
        collect(DATE_ISO.matcher(raw), 1, 2, 3, found);
        collect(DATE_DMY.matcher(raw), 3, 2, 1, found);

        Matcher named = DATE_MONTH_NAME.matcher(raw);
        while (named.find()) {
            int month = monthNumber(named.group(2));
            if (month > 0) {
                toDate(named.group(3), String.valueOf(month), named.group(1))
                    .ifPresent(date -> found.add(new PositionedDate(named.start(), date)));
            }
        }

        return found.stream()
            .min(Comparator.comparingInt(PositionedDate::position))
            .map(positioned -> positioned.date().toString());
    }

    boolean isPlausibleYear(int year) {
        return year >= MIN_YEAR && year <= Year.now(clock).getValue() + 1;
    }

    private void collect(Matcher matcher, int yearGroup, int monthGroup, int dayGroup, List<PositionedDate> out) {
        while (matcher.find()) {
            int start = matcher.start();
            toDate(matcher.group(yearGroup), matcher.group(monthGroup), matcher.group(dayGroup))
                .ifPresent(date -> out.add(new PositionedDate(start, date)));
        }
    }

    private Optional<LocalDate> toDate(String year, String month, String day) {
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
            return isPlausibleYear(date.getYear()) ? Optional.of(date) : Optional.empty();
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static int monthNumber(String word) {
        String folded = TextNormalizer.foldOcr(word);
        for (int i = 0; i < MONTHS.size(); i++) {
            if (folded.startsWith(MONTHS.get(i))) {
                return i + 1;
            }
        }
        return 0;
    }

    private static boolean breaksName(String word) {
        String folded = TextNormalizer.foldOcr(word.replaceAll("[.'’]+$", ""));
        for (String breaker : NAME_BREAKERS) {
            if (AzerbaijaniTokenizer.matchesWord(folded, TextNormalizer.foldOcr(breaker))) {
                return true;
            }
        }
        return false;
    }

    private record PositionedDate(int position, LocalDate date) {
    }
}
