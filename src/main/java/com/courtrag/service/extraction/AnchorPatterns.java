package com.courtrag.service.extraction;

import com.courtrag.util.TextNormalizer;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regex building blocks for label anchors in noisy OCR text.
 *
 * <p>An anchor accepts every letter in either case and in its OCR-confusable
 * plain Latin form, tolerates one stray non-letter between letters and any
 * amount of whitespace where the label has a space.</p>
 */
final class AnchorPatterns {

    static final String OPTIONAL_SEPARATOR = "\\s*[:.\\-–—]?\\s*";
    static final String REQUIRED_SEPARATOR = "\\s*[:.\\-–—]\\s*";
    private static final char PARAGRAPH_CHAR = '\u2029';
    private static final String PARAGRAPH = String.valueOf(PARAGRAPH_CHAR);

    static final String VALUE = "([^;|\\n]{1,160})";

    static final List<String> PARTY_LABELS = List.of(
        "İddiaçı", "Ərizəçi", "Məhkum", "Cavabdeh", "Təqsirləndirilən");

    private static final List<String> KNOWN_LABELS = List.of(
        "Məhkəmənin adı", "İş No", "İş №", "İş nömrəsi", "Hakim", "Katib", "İclas katibi",
        "İşin növü", "Məhkəmə aktı", "Rayon", "İl", "Tarix", "Qərarın tarixi", "Qətetdi",
        "İddiaçı", "Ərizəçi", "Məhkum", "Cavabdeh", "Təqsirləndirilən");

    /**
     * Any known label followed by a separator, i.e. the start of the next field.
     */
    static final Pattern LABEL_BOUNDARY = Pattern.compile(
        KNOWN_LABELS.stream()
            .map(label -> anchor(label, true))
            .collect(Collectors.joining("|", "(?:", ")\\s*[:\\-–—]")));

    private AnchorPatterns() {
    }

    static String anchor(String label) {
        return anchor(label, true);
    }

    /**
     * Build the regex for a label. With {@code wordEnd} the anchor may not be
     * followed by a letter.
     */
    static String anchor(String label, boolean wordEnd) {
        StringBuilder sb = new StringBuilder("(?<!\\p{L})");
        boolean previousLetter = false;
        boolean previousSpace = false;

        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (Character.isWhitespace(c)) {
                if (!previousSpace) {
                    sb.append("\\s*");
                }
                previousSpace = true;
                previousLetter = false;
                continue;
            }
            if (Character.isLetter(c)) {
                if (previousLetter) {
                    sb.append("[^\\p{L}\\s]?");
                }
                sb.append(letterClass(c));
                previousLetter = true;
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
                previousLetter = false;
            }
            previousSpace = false;
        }

        if (wordEnd) {
            sb.append("(?!\\p{L})");
        }
        return sb.toString();
    }

    static Pattern labeled(String label, boolean requireSeparator) {
        return Pattern.compile(anchor(label)
            + (requireSeparator ? REQUIRED_SEPARATOR : OPTIONAL_SEPARATOR) + VALUE);
    }

    static Pattern labeledAny(List<String> labels) {
        String alternatives = labels.stream()
            .map(AnchorPatterns::anchor)
            .collect(Collectors.joining("|", "(?:", ")"));
        return Pattern.compile(alternatives + OPTIONAL_SEPARATOR + VALUE);
    }

    /**
     * Join single line breaks into spaces and keep paragraph breaks as the only
     * newlines, so a value wrapped over two lines reads as one.
     */
    static String flatten(String text) {
        return text.replace("\n\n", PARAGRAPH)
            .replace('\n', ' ')
            .replace(PARAGRAPH_CHAR, '\n');
    }

    /**
     * Cut a captured value at the first following label.
     */
    static String cutAtNextLabel(String value) {
        var matcher = LABEL_BOUNDARY.matcher(value);
        while (matcher.find()) {
            if (matcher.start() > 0) {
                return value.substring(0, matcher.start());
            }
        }
        return value;
    }

    private static String letterClass(char c) {
        String s = String.valueOf(c);
        Set<Character> variants = new LinkedHashSet<>();
        addAll(variants, s.toLowerCase(TextNormalizer.AZERBAIJANI));
        addAll(variants, s.toUpperCase(TextNormalizer.AZERBAIJANI));

        char lower = s.toLowerCase(TextNormalizer.AZERBAIJANI).charAt(0);
        switch (lower) {
            case 'i':
            case 'ı':
                addAll(variants, "iİIı");
                break;
            default:
                char plain = TextNormalizer.plainLetter(lower);
                if (plain != lower) {
                    variants.add(plain);
                    variants.add(Character.toUpperCase(plain));
                }
        }

        StringBuilder cls = new StringBuilder("[");
        for (char v : variants) {
            cls.append(v);
        }
        return cls.append(']').toString();
    }

    private static void addAll(Set<Character> target, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            target.add(chars.charAt(i));
        }
    }
}
