package com.courtrag.service.dialogue;

import com.courtrag.model.MetadataField;
import com.courtrag.util.AzerbaijaniTokenizer.Token;
import com.courtrag.util.AzerbaijaniTokenizer;
import com.courtrag.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Finds known facet values in an utterance. A value's significant tokens (three
 * letters or more) match utterance words carrying any case or possessive
 * ending; only the values with the most matched tokens are returned.
 */
@Component
@RequiredArgsConstructor
class FacetValueMatcher {

    static final int MIN_TOKEN_LENGTH = 3;

    /**
     * Words shared by many court names; they count only next to a distinctive word.
     */
    private static final Set<String> GENERIC_COURT_WORDS = Set.of(
        "rayon", "şəhər", "məhkəmə", "məhkəməsi", "apellyasiya", "inzibati", "kommersiya",
        "ağır", "cinayətlər", "iqtisadi", "ali", "hərbi", "respublikası"
    ).stream().map(TextNormalizer::foldOcr).collect(Collectors.toSet());

    private final AzerbaijaniTokenizer tokenizer;

    List<FieldCandidate> match(MetadataField field, Collection<String> values, List<Token> utterance) {
        List<FieldCandidate> matches = new ArrayList<>();
        for (String value : values) {
            FieldCandidate candidate = score(field, value, utterance);
            if (candidate != null) {
                matches.add(candidate);
            }
        }

        int best = matches.stream().mapToInt(FieldCandidate::matchedTokens).max().orElse(0);
        return matches.stream()
            .filter(candidate -> candidate.matchedTokens() == best)
            .collect(Collectors.toList());
    }

    private FieldCandidate score(MetadataField field, String value, List<Token> utterance) {
        List<String> significant = tokenizer.tokenize(value).stream()
            .map(Token::folded)
            .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
            .distinct()
            .collect(Collectors.toList());
        if (significant.isEmpty()) {
            return null;
        }

        boolean court = field == MetadataField.COURT_NAME;
        boolean hasDistinctive = !court || significant.stream().anyMatch(token -> !GENERIC_COURT_WORDS.contains(token));

        int matched = 0;
        boolean distinctiveMatched = false;
        Set<Integer> spans = new LinkedHashSet<>();
        for (String token : significant) {
            int index = indexOf(token, utterance);
            if (index < 0) {
                continue;
            }
            matched++;
            spans.add(index);
            if (!court || !hasDistinctive || !GENERIC_COURT_WORDS.contains(token)) {
                distinctiveMatched = true;
            }
        }

        if (matched == 0 || !distinctiveMatched) {
            return null;
        }
        return new FieldCandidate(field, value, matched, significant.size(), spans);
    }

    private static int indexOf(String valueToken, List<Token> utterance) {
        for (int i = 0; i < utterance.size(); i++) {
            if (AzerbaijaniTokenizer.matchesStem(utterance.get(i).folded(), valueToken)) {
                return i;
            }
        }
        return -1;
    }
}
