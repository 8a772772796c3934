package com.courtrag.service.extraction;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One surface pattern for a field: returns every raw candidate in text order.
 */
@FunctionalInterface
public interface FieldLocator {

    List<String> locate(String text);

    /**
     * Candidates are the first capture group of every match.
     */
    static FieldLocator pattern(Pattern pattern) {
        return text -> {
            List<String> candidates = new ArrayList<>();
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                candidates.add(matcher.group(1));
            }
            return candidates;
        };
    }

    /**
     * Like {@link #pattern(Pattern)}, with each capture cut at the next known label.
     */
    static FieldLocator labeled(Pattern pattern) {
        return text -> {
            List<String> candidates = new ArrayList<>();
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                candidates.add(AnchorPatterns.cutAtNextLabel(matcher.group(1)));
            }
            return candidates;
        };
    }
}
