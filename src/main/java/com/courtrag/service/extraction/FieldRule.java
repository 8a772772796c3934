package com.courtrag.service.extraction;

import com.courtrag.model.MetadataField;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Strategy table row: a field, its locators in priority order and the
 * normalizer a candidate must survive.
 */
public record FieldRule(
    MetadataField field,
    List<FieldLocator> locators,
    Function<String, Optional<String>> normalizer
) {

    public FieldRule {
        locators = List.copyOf(locators);
    }

    /**
     * First candidate, by locator priority then text order, that normalizes to a value.
     */
    public Optional<String> firstMatch(String text) {
        for (FieldLocator locator : locators) {
            for (String candidate : locator.locate(text)) {
                Optional<String> value = normalizer.apply(candidate);
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every candidate of every locator that normalizes, in priority order.
     */
    public List<String> allMatches(String text) {
        return locators.stream()
            .flatMap(locator -> locator.locate(text).stream())
            .map(normalizer)
            .flatMap(Optional::stream)
            .distinct()
            .collect(Collectors.toList());
    }
}
