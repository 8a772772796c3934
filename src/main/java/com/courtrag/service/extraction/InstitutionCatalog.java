package com.courtrag.service.extraction;

import com.courtrag.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Closed list of known courts and districts used to canonicalize extracted
 * institution names.
 *
 * <p>Two names are the same institution when their {@link TextNormalizer#catalogKey}
 * forms are equal or within a small edit distance. Names not in the catalog are
 * returned verbatim with whitespace collapsed.</p>
 */
@Slf4j
public class InstitutionCatalog {

    private static final Pattern VENUE_SUFFIX = Pattern.compile("\\s+(rayon|seher|qesebe)\\p{L}*$");

    private final List<Entry> courts;
    private final List<Entry> districts;

    public InstitutionCatalog(List<String> knownCourts, List<String> knownDistricts) {
        this.courts = knownCourts.stream()
            .filter(name -> name != null && !name.isBlank())
            .map(name -> new Entry(TextNormalizer.collapseWhitespace(name)))
            .collect(Collectors.toList());
        this.districts = knownDistricts.stream()
            .filter(name -> name != null && !name.isBlank())
            .map(name -> new Entry(TextNormalizer.collapseWhitespace(name)))
            .collect(Collectors.toList());
        log.info("Institution catalog: {} courts, {} districts", courts.size(), districts.size());
    }

    public String canonicalCourt(String name) {
        String verbatim = TextNormalizer.collapseWhitespace(name);
        return closest(courts, TextNormalizer.catalogKey(verbatim))
            .map(Entry::canonical)
            .orElse(verbatim);
    }

    public String canonicalDistrict(String name) {
        String verbatim = TextNormalizer.collapseWhitespace(name);
        String key = TextNormalizer.catalogKey(verbatim);

        Optional<Entry> match = closest(districts, key);
        if (match.isEmpty()) {
            String bare = VENUE_SUFFIX.matcher(key).replaceFirst("");
            if (!bare.equals(key) && !bare.isEmpty()) {
                match = closest(districts, bare);
            }
        }
        return match.map(Entry::canonical).orElse(verbatim);
    }

    public boolean isKnownCourt(String name) {
        return closest(courts, TextNormalizer.catalogKey(name)).isPresent();
    }

    /**
     * Known court occurring earliest in the text; longer names win a tie.
     */
    public Optional<String> findCourtIn(String text) {
        Entry best = null;
        int bestStart = Integer.MAX_VALUE;
        for (Entry court : courts) {
            Matcher matcher = court.pattern().matcher(text);
            if (matcher.find()) {
                int start = matcher.start();
                if (start < bestStart
                        || (start == bestStart && court.canonical().length() > best.canonical().length())) {
                    best = court;
                    bestStart = start;
                }
            }
        }
        return Optional.ofNullable(best).map(Entry::canonical);
    }

    /**
     * Catalog district whose name appears as a word in the court name.
     */
    public Optional<String> districtOfCourt(String courtName) {
        String courtKey = " " + TextNormalizer.catalogKey(courtName) + " ";
        return districts.stream()
            .filter(district -> courtKey.contains(" " + district.key() + " "))
            .max(Comparator.comparingInt(district -> district.key().length()))
            .map(Entry::canonical);
    }

    public List<String> getCourts() {
        return courts.stream().map(Entry::canonical).collect(Collectors.toList());
    }

    public List<String> getDistricts() {
        return districts.stream().map(Entry::canonical).collect(Collectors.toList());
    }

    private Optional<Entry> closest(List<Entry> entries, String key) {
        if (key.isEmpty()) {
            return Optional.empty();
        }

        List<Entry> candidates = new ArrayList<>();
        int bestDistance = Integer.MAX_VALUE;
        for (Entry entry : entries) {
            if (entry.key().equals(key)) {
                return Optional.of(entry);
            }
            int allowed = Math.max(1, entry.key().length() / 15);
            if (Math.abs(entry.key().length() - key.length()) > allowed) {
                continue;
            }
            int distance = levenshtein(entry.key(), key);
            if (distance <= allowed) {
                if (distance < bestDistance) {
                    candidates.clear();
                    bestDistance = distance;
                }
                if (distance == bestDistance) {
                    candidates.add(entry);
                }
            }
        }
        // two equally close entries: keep the value verbatim
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Entry(String canonical, String key, Pattern pattern) {

        Entry(String canonical) {
            this(canonical, TextNormalizer.catalogKey(canonical), Pattern.compile(AnchorPatterns.anchor(canonical)));
        }
    }
}
