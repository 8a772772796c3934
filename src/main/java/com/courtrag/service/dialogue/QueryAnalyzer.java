package com.courtrag.service.dialogue;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.model.DecisionType;
import com.courtrag.model.MetadataField;
import com.courtrag.service.index.FacetCache;
import com.courtrag.service.index.VectorIndex;
import com.courtrag.service.search.FilterMatcher;
import com.courtrag.util.AzerbaijaniTokenizer.Token;
import com.courtrag.util.AzerbaijaniTokenizer;
import com.courtrag.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a user utterance into search filters plus residual free text, and
 * drives the clarification dialogue when a field matches several known values.
 *
 * <p>Recognition works against the facet cache: a known judge, court, district
 * or case type is recognized when its words appear in the utterance with any
 * grammatical ending. Years, case numbers and decision types are recognized
 * from their shape. A field with as many candidates as the ambiguity threshold
 * is asked about, one field per question; after the configured number of
 * questions the best candidate is taken and the result is marked best effort.</p>
 */
@Slf4j
@Service
public class QueryAnalyzer {

    static final String PROMPT_WELCOME =
        "Salam! Hansı məhkəmə qərarlarını axtarırsınız? Hakimin adını, məhkəməni, ili və ya işin mövzusunu yaza bilərsiniz.";
    static final String PROMPT_CLARIFY = "Sorğunuza uyğun bir neçə %s var. Hansını nəzərdə tutursunuz?\n%s\nNömrəni və ya tam adı yazın.";
    static final String PROMPT_NOT_UNDERSTOOD = "Cavabınızı müəyyən edə bilmədim. ";

    private static final List<MetadataField> VALUE_FIELDS = List.of(
        MetadataField.JUDGE, MetadataField.COURT_NAME, MetadataField.DISTRICT, MetadataField.CASE_TYPE);

    private static final List<DecisionType> QUERYABLE_DECISION_TYPES = List.of(
        DecisionType.QETNAME, DecisionType.QERARNAME, DecisionType.HOKM);

    private static final Pattern YEAR_TOKEN = Pattern.compile("^(\\d{4})(?:['’\\-]?\\p{L}{1,4})?$");
    private static final Pattern ORDINAL_NUMBER = Pattern.compile("^(\\d{1,2})(?:['’\\-.]?\\p{L}*)?$");

    private static final Set<String> GREETINGS = Set.of(
        "salam", "salamlar", "aleykum", "eleykum", "sabahiniz", "axsaminiz", "gunortaniz",
        "xeyir", "xeyirli", "necesen", "necesiniz", "sag", "ol", "hello", "hi", "hey"
    );

    private static final List<String> ORDINALS = List.of(
        "birinci", "ikinci", "ucuncu", "dorduncu", "besinci",
        "altinci", "yeddinci", "sekkizinci", "doqquzuncu", "onuncu"
    );
    private static final String LAST = "sonuncu";

    private final FacetCache facetCache;
    private final VectorIndex vectorIndex;
    private final AzerbaijaniTokenizer tokenizer;
    private final FacetValueMatcher matcher;
    private final CourtRagProperties properties;
    private final Clock clock;

    public QueryAnalyzer(FacetCache facetCache,
                         VectorIndex vectorIndex,
                         AzerbaijaniTokenizer tokenizer,
                         FacetValueMatcher matcher,
                         CourtRagProperties properties,
                         Clock clock) {
        this.facetCache = facetCache;
        this.vectorIndex = vectorIndex;
        this.tokenizer = tokenizer;
        this.matcher = matcher;
        this.properties = properties;
        this.clock = clock;
    }

    public AnalysisResult analyze(String utterance, ConversationState state) {
        ConversationState current = state == null ? ConversationState.initial() : state;
        String text = utterance == null ? "" : utterance.strip();

        if (current.phase() == ConversationPhase.AWAITING_CLARIFICATION && current.pendingField().isPresent()) {
            return resolveClarification(text, current);
        }
        return analyzeQuery(text);
    }

    private AnalysisResult analyzeQuery(String text) {
        List<Token> tokens = tokenizer.tokenize(text);
        if (tokens.isEmpty() || isGreeting(tokens)) {
            ConversationState next = ConversationState.initial();
            return new AnalysisResult(Map.of(), "", next, Optional.of(PROMPT_WELCOME), Map.of(), false);
        }

        Map<MetadataField, List<String>> recognized = new LinkedHashMap<>();
        Set<Integer> used = new HashSet<>();

        Map<MetadataField, List<FieldCandidate>> matches = new LinkedHashMap<>();
        for (MetadataField field : VALUE_FIELDS) {
            List<FieldCandidate> found = matcher.match(field, facetCache.values(field), tokens);
            if (!found.isEmpty()) {
                matches.put(field, found);
            }
        }
        dropCourtsNamedOnlyByDistrict(matches);
        matches.forEach((field, found) -> {
            recognized.put(field, found.stream().map(FieldCandidate::value).collect(Collectors.toList()));
            found.forEach(candidate -> used.addAll(candidate.spans()));
        });

        recognizeShapes(tokens, recognized, used);

        Map<MetadataField, String> filters = new EnumMap<>(MetadataField.class);
        Map<MetadataField, List<String>> ambiguous = new LinkedHashMap<>();
        recognized.forEach((field, values) -> {
            if (values.size() == 1) {
                filters.put(field, values.get(0));
            } else {
                ambiguous.put(field, values);
            }
        });

        narrow(filters, ambiguous);

        String residual = residual(tokens, used);
        log.debug("Analyzed '{}': filters={} ambiguous={} residual='{}'", text, filters, ambiguous, residual);

        if (ambiguous.isEmpty()) {
            return ready(filters, residual, false, Map.of());
        }
        return ask(filters, residual, ambiguous, 0, false);
    }

    private AnalysisResult resolveClarification(String reply, ConversationState state) {
        MetadataField field = state.pendingField().orElseThrow();
        List<String> candidates = state.pendingCandidates();

        Map<MetadataField, String> filters = new EnumMap<>(MetadataField.class);
        filters.putAll(state.filters());
        Map<MetadataField, List<String>> pending = new LinkedHashMap<>(state.pending());

        List<Token> tokens = tokenizer.tokenize(reply);
        Optional<String> choice = byOrdinal(tokens, candidates);
        List<String> remaining = candidates;
        if (choice.isEmpty()) {
            List<FieldCandidate> found = byValue(reply, field, candidates, tokens);
            if (found.size() == 1) {
                choice = Optional.of(found.get(0).value());
            } else if (found.size() > 1) {
                remaining = found.stream().map(FieldCandidate::value).collect(Collectors.toList());
            }
        }

        if (choice.isPresent()) {
            log.debug("Clarified {} as '{}'", field.getKey(), choice.get());
            filters.put(field, choice.get());
            pending.remove(field);
            if (pending.isEmpty()) {
                return ready(filters, state.pendingResidual(), false, Map.of());
            }
            return ask(filters, state.pendingResidual(), pending, state.roundsUsed(), false);
        }

        pending.put(field, remaining);
        return ask(filters, state.pendingResidual(), pending, state.roundsUsed(), true);
    }

    /**
     * Asks about the first pending field, or guesses every pending field once
     * the clarification rounds are used up.
     */
    private AnalysisResult ask(Map<MetadataField, String> filters,
                               String residual,
                               Map<MetadataField, List<String>> pending,
                               int roundsUsed,
                               boolean repeated) {
        if (roundsUsed >= properties.getMaxClarificationRounds()) {
            Map<MetadataField, String> guessed = new EnumMap<>(MetadataField.class);
            guessed.putAll(filters);
            pending.forEach((field, candidates) -> guessed.put(field, bestGuess(field, candidates)));
            log.info("Clarification rounds exhausted, guessed {}", guessed);
            return ready(guessed, residual, true, pending);
        }

        MetadataField field = pending.keySet().iterator().next();
        List<String> candidates = pending.get(field);
        String prompt = (repeated ? PROMPT_NOT_UNDERSTOOD : "") + clarificationPrompt(field, candidates);

        ConversationState next = new ConversationState(
            ConversationPhase.AWAITING_CLARIFICATION, filters, residual, pending, roundsUsed + 1);
        return new AnalysisResult(Map.copyOf(filters), residual, next, Optional.of(prompt),
            Map.of(field, List.copyOf(candidates)), false);
    }

    private AnalysisResult ready(Map<MetadataField, String> filters,
                                 String residual,
                                 boolean bestEffort,
                                 Map<MetadataField, List<String>> unresolved) {
        ConversationState next = new ConversationState(ConversationPhase.READY_TO_SEARCH, filters, residual, Map.of(), 0);
        Map<MetadataField, List<String>> candidates = new LinkedHashMap<>();
        unresolved.forEach((field, values) -> candidates.put(field, List.copyOf(values)));
        return new AnalysisResult(next.filters(), residual, next, Optional.empty(), candidates, bestEffort);
    }

    static String clarificationPrompt(MetadataField field, List<String> candidates) {
        StringBuilder options = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            if (i > 0) {
                options.append('\n');
            }
            options.append(i + 1).append(". ").append(candidates.get(i));
        }
        return String.format(PROMPT_CLARIFY, field.getLabel(), options);
    }

    private void dropCourtsNamedOnlyByDistrict(Map<MetadataField, List<FieldCandidate>> matches) {
        List<FieldCandidate> districts = matches.get(MetadataField.DISTRICT);
        List<FieldCandidate> courts = matches.get(MetadataField.COURT_NAME);
        if (districts == null || courts == null) {
            return;
        }
        Set<Integer> districtSpans = new HashSet<>();
        districts.forEach(candidate -> districtSpans.addAll(candidate.spans()));

        List<FieldCandidate> kept = courts.stream()
            .filter(candidate -> !districtSpans.containsAll(candidate.spans()))
            .collect(Collectors.toList());
        if (kept.isEmpty()) {
            matches.remove(MetadataField.COURT_NAME);
        } else {
            matches.put(MetadataField.COURT_NAME, kept);
        }
    }

    private void recognizeShapes(List<Token> tokens, Map<MetadataField, List<String>> recognized, Set<Integer> used) {
        List<String> decisionTypes = new ArrayList<>();
        List<String> years = new ArrayList<>();
        List<String> caseNumbers = new ArrayList<>();
        int maxYear = Year.now(clock).getValue() + 1;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);

            Matcher year = YEAR_TOKEN.matcher(token.surface());
            if (year.matches()) {
                int value = Integer.parseInt(year.group(1));
                if (value >= 1900 && value <= maxYear) {
                    addDistinct(years, year.group(1));
                    used.add(i);
                    continue;
                }
            }

            if (token.hasDigit() && (token.surface().contains("/") || token.surface().contains("("))) {
                addDistinct(caseNumbers, token.surface());
                used.add(i);
                continue;
            }

            for (DecisionType type : QUERYABLE_DECISION_TYPES) {
                if (AzerbaijaniTokenizer.matchesStem(token.folded(), TextNormalizer.foldOcr(type.getLabel()))) {
                    addDistinct(decisionTypes, type.getLabel());
                    used.add(i);
                    break;
                }
            }
        }

        if (!decisionTypes.isEmpty()) {
            recognized.put(MetadataField.DECISION_TYPE, decisionTypes);
        }
        if (!years.isEmpty()) {
            recognized.put(MetadataField.YEAR, years);
        }
        if (!caseNumbers.isEmpty()) {
            recognized.put(MetadataField.CASE_NUMBER, caseNumbers);
        }
    }

    /**
     * Keeps only candidates that co-occur with the already resolved filters in
     * some indexed document. A single survivor resolves the field; with none,
     * the original candidates stand. Fields left with fewer candidates than the
     * ambiguity threshold are resolved silently.
     */
    private void narrow(Map<MetadataField, String> filters, Map<MetadataField, List<String>> ambiguous) {
        for (MetadataField field : new ArrayList<>(ambiguous.keySet())) {
            List<String> candidates = ambiguous.get(field);
            if (!filters.isEmpty()) {
                Map<MetadataField, String> context = Map.copyOf(filters);
                List<String> backed = candidates.stream()
                    .filter(value -> isBacked(context, field, value))
                    .collect(Collectors.toList());
                if (backed.size() == 1) {
                    filters.put(field, backed.get(0));
                    ambiguous.remove(field);
                    continue;
                }
                if (!backed.isEmpty()) {
                    candidates = backed;
                    ambiguous.put(field, backed);
                }
            }
            if (candidates.size() < properties.getAmbiguityMinCandidates()) {
                filters.put(field, bestGuess(field, candidates));
                ambiguous.remove(field);
            }
        }
    }

    private boolean isBacked(Map<MetadataField, String> filters, MetadataField field, String value) {
        return vectorIndex.entries().stream()
            .anyMatch(entry -> FilterMatcher.matchesAll(entry.metadata(), filters)
                && FilterMatcher.matches(entry.metadata(), field, value));
    }

    String bestGuess(MetadataField field, List<String> candidates) {
        Comparator<String> byDocuments = Comparator.comparingInt((String value) -> facetCache.documentCount(field, value)).reversed();
        Comparator<String> byLength = Comparator.comparingInt(String::length).reversed();

        Comparator<String> order = properties.getCandidatePriority() == CandidatePriority.LONGEST_MATCH
            ? byLength.thenComparing(byDocuments)
            : byDocuments.thenComparing(byLength);

        return candidates.stream()
            .min(order.thenComparing(Comparator.naturalOrder()))
            .orElseThrow(() -> new IllegalStateException("No candidates for " + field.getKey()));
    }

    private Optional<String> byOrdinal(List<Token> tokens, List<String> candidates) {
        if (tokens.size() > 3) {
            return Optional.empty();
        }
        for (Token token : tokens) {
            Matcher number = ORDINAL_NUMBER.matcher(token.surface());
            if (number.matches()) {
                int index = Integer.parseInt(number.group(1)) - 1;
                return index >= 0 && index < candidates.size() ? Optional.of(candidates.get(index)) : Optional.empty();
            }
            if (AzerbaijaniTokenizer.matchesStem(token.folded(), LAST)) {
                return Optional.of(candidates.get(candidates.size() - 1));
            }
            for (int i = 0; i < ORDINALS.size() && i < candidates.size(); i++) {
                if (AzerbaijaniTokenizer.matchesStem(token.folded(), ORDINALS.get(i))) {
                    return Optional.of(candidates.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Candidates named by the reply. An exact name wins; otherwise among the
     * best-scoring candidates a single full match wins over partial ones.
     */
    private List<FieldCandidate> byValue(String reply, MetadataField field, List<String> candidates, List<Token> tokens) {
        String folded = TextNormalizer.fold(reply);
        for (String candidate : candidates) {
            if (TextNormalizer.fold(candidate).equals(folded)) {
                return List.of(new FieldCandidate(field, candidate, 1, 1, Set.of()));
            }
        }

        List<FieldCandidate> found = matcher.match(field, candidates, tokens);
        List<FieldCandidate> full = found.stream().filter(FieldCandidate::isFullMatch).collect(Collectors.toList());
        return full.size() == 1 ? full : found;
    }

    private String residual(List<Token> tokens, Set<Integer> used) {
        List<String> words = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!used.contains(i) && !tokenizer.isStopWord(token) && !GREETINGS.contains(token.folded())) {
                words.add(token.surface());
            }
        }
        return String.join(" ", words);
    }

    private static boolean isGreeting(List<Token> tokens) {
        return tokens.stream().allMatch(token -> GREETINGS.contains(token.folded()));
    }

    private static void addDistinct(List<String> values, String value) {
        if (!values.contains(value)) {
            values.add(value);
        }
    }
}
