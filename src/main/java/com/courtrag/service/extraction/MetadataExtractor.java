package com.courtrag.service.extraction;

import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import com.courtrag.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rule-based extraction of case metadata from normalized ruling text.
 *
 * <p>Each {@link FieldRule} is evaluated on its own; a rule that finds nothing,
 * or fails, leaves its field unknown. A validation pass then reconciles year and
 * decision date.</p>
 */
@Slf4j
@Service
public class MetadataExtractor {

    private static final Pattern GENERIC_COURT = Pattern.compile(
        "((?:\\p{Lu}[\\p{L}\\-]*\\s+){1,4}" + AnchorPatterns.anchor("Məhkəməsi") + ")");
    private static final Pattern VENUE = Pattern.compile(
        "(?<!\\p{L})(\\p{Lu}\\p{L}+)\\s+(?:" + AnchorPatterns.anchor("rayon", false)
            + "|" + AnchorPatterns.anchor("şəhər", false) + "|" + AnchorPatterns.anchor("qəsəbə", false) + ")");
    private static final Pattern CASE_NUMBER_SHAPE = Pattern.compile(
        "(?<![\\w/])(\\d{1,2}(?:-\\d{1,2})?\\(\\d{2,3}\\)-\\d{1,6}/\\d{4})(?!\\d)");
    private static final Pattern CASE_TYPE_PHRASE = Pattern.compile(
        "(?<!\\p{L})(inzibati xeta|inzibati|mulki|kommersiya|iqtisadi|cinayet)\\s+is");
    private static final Pattern DECISION_HEADING = Pattern.compile(
        "(?<!\\p{L})(Q[ƏE]RARNAM[ƏE]|Q[ƏE]TNAM[ƏE]|Q[ƏE]RAR|H[ÖO]KM)(?!\\p{L})");
    private static final Pattern DECISION_WORD = Pattern.compile("(?<!\\p{L})(qerarname|qetname|hokm)");
    private static final Pattern ORDINAL_YEAR = Pattern.compile("(?<!\\d)(\\d{4})\\s*-?\\s*c[iu]\\s+il(?!\\p{L})");
    private static final Pattern ANY_YEAR = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");
    private static final Pattern WHOLE_TEXT = Pattern.compile("(?s)\\A(.*)\\z");

    private final InstitutionCatalog catalog;
    private final FieldNormalizers normalizers;
    private final List<FieldRule> rules;
    private final FieldRule partiesRule;

    public MetadataExtractor(InstitutionCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.normalizers = new FieldNormalizers(catalog, clock);
        this.rules = buildRules();
        this.partiesRule = new FieldRule(MetadataField.PARTIES,
            List.of(FieldLocator.labeled(AnchorPatterns.labeledAny(AnchorPatterns.PARTY_LABELS))),
            normalizers::party);
    }

    private List<FieldRule> buildRules() {
        return List.of(
            new FieldRule(MetadataField.COURT_NAME, List.of(
                FieldLocator.labeled(AnchorPatterns.labeled("Məhkəmənin adı", false)),
                text -> catalog.findCourtIn(text).stream().collect(Collectors.toList()),
                FieldLocator.pattern(GENERIC_COURT)),
                normalizers::courtName),

            new FieldRule(MetadataField.CASE_NUMBER, List.of(
                FieldLocator.labeled(AnchorPatterns.labeledAny(List.of("İş No", "İş №", "İş nömrəsi"))),
                FieldLocator.pattern(CASE_NUMBER_SHAPE)),
                normalizers::caseNumber),

            new FieldRule(MetadataField.JUDGE, List.of(
                FieldLocator.labeled(AnchorPatterns.labeled("Hakim", false))),
                normalizers::personName),

            new FieldRule(MetadataField.CASE_TYPE, List.of(
                FieldLocator.labeled(AnchorPatterns.labeled("İşin növü", false)),
                folded(CASE_TYPE_PHRASE)),
                normalizers::caseType),

            new FieldRule(MetadataField.DISTRICT, List.of(
                FieldLocator.labeled(AnchorPatterns.labeled("Rayon", true)),
                FieldLocator.pattern(VENUE)),
                normalizers::district),

            new FieldRule(MetadataField.DECISION_TYPE, List.of(
                FieldLocator.pattern(DECISION_HEADING),
                FieldLocator.labeled(AnchorPatterns.labeled("Məhkəmə aktı", false)),
                folded(DECISION_WORD)),
                normalizers::decisionType),

            new FieldRule(MetadataField.YEAR, List.of(
                FieldLocator.labeled(AnchorPatterns.labeled("İl", true)),
                folded(ORDINAL_YEAR),
                FieldLocator.pattern(ANY_YEAR)),
                normalizers::year),

            new FieldRule(MetadataField.DECISION_DATE, List.of(
                FieldLocator.labeled(AnchorPatterns.labeledAny(List.of("Qərarın tarixi", "Tarix"))),
                FieldLocator.pattern(WHOLE_TEXT)),
                normalizers::date)
        );
    }

    /**
     * Extract a metadata record. Never throws; unmatched fields stay unknown.
     */
    public MetadataRecord extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return MetadataRecord.empty();
        }

        String text = AnchorPatterns.flatten(normalizedText);
        MetadataRecord.Builder builder = MetadataRecord.builder();

        for (FieldRule rule : rules) {
            try {
                Optional<String> value = rule.firstMatch(text);
                if (value.isPresent()) {
                    builder.set(rule.field(), value.get());
                } else {
                    log.debug("No value for {}", rule.field().getKey());
                }
            } catch (RuntimeException e) {
                log.warn("Rule for {} failed, leaving it unknown: {}", rule.field().getKey(), e.getMessage());
            }
        }

        try {
            builder.parties(partiesRule.allMatches(text));
        } catch (RuntimeException e) {
            log.warn("Party extraction failed, leaving parties unknown: {}", e.getMessage());
        }

        MetadataRecord record = validate(builder.build());
        log.debug("Extracted {} of {} fields", record.knownFieldCount(), MetadataField.values().length);
        return record;
    }

    /**
     * Reconcile year with decision date and fill the district from a known court.
     */
    MetadataRecord validate(MetadataRecord record) {
        MetadataRecord.Builder builder = record.toBuilder();
        Optional<LocalDate> date = record.decisionDate();
        Optional<Integer> year = record.year();

        if (date.isPresent()) {
            int dateYear = date.get().getYear();
            if (year.isEmpty()) {
                builder.set(MetadataField.YEAR, String.valueOf(dateYear));
            } else if (year.get() != dateYear) {
                log.info("Year {} disagrees with decision date {}, using the date's year", year.get(), date.get());
                builder.set(MetadataField.YEAR, String.valueOf(dateYear));
                builder.partiallyAmbiguous(true);
            }
        }

        if (!record.isKnown(MetadataField.DISTRICT)) {
            record.get(MetadataField.COURT_NAME)
                .flatMap(catalog::districtOfCourt)
                .ifPresent(district -> builder.set(MetadataField.DISTRICT, district));
        }

        return builder.build();
    }

    /**
     * Locator matching against the OCR-folded text.
     */
    private static FieldLocator folded(Pattern pattern) {
        FieldLocator delegate = FieldLocator.pattern(pattern);
        return text -> delegate.locate(TextNormalizer.foldOcr(text));
    }
}
