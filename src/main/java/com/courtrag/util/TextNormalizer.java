package com.courtrag.util;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class TextNormalizer {

    public static final Locale AZERBAIJANI = Locale.forLanguageTag("az");

    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\n]]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("\\h+");
    private static final Pattern LINE_EDGE_SPACE = Pattern.compile(" *\\n *");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern ANY_SPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    /**
     * Normalize extracted document text: NFC composition, format and control
     * characters removed, horizontal whitespace collapsed, lines trimmed and
     * blank-line runs reduced to one paragraph break.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String text = Normalizer.normalize(raw, Normalizer.Form.NFC);
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = FORMAT_CHARS.matcher(text).replaceAll("");
        text = CONTROL_CHARS.matcher(text).replaceAll(" ");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = LINE_EDGE_SPACE.matcher(text).replaceAll("\n");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");

        return text.strip();
    }

    /**
     * Lower-case with Azerbaijani casing rules (I → ı, İ → i) and collapse
     * whitespace.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        return collapseWhitespace(composed.toLowerCase(AZERBAIJANI));
    }

    /**
     * {@link #fold(String)} followed by mapping every Azerbaijani letter to the
     * plain Latin letter OCR tends to produce for it.
     */
    public static String foldOcr(String text) {
        String folded = fold(text);
        StringBuilder sb = new StringBuilder(folded.length());
        for (int i = 0; i < folded.length(); i++) {
            sb.append(plainLetter(folded.charAt(i)));
        }
        return sb.toString();
    }

    /**
     * Comparison key for institution names: OCR-folded, punctuation dropped,
     * single spaces.
     */
    public static String catalogKey(String text) {
        return NON_ALNUM.matcher(foldOcr(text)).replaceAll(" ").trim();
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return ANY_SPACE.matcher(text).replaceAll(" ").trim();
    }

    public static char plainLetter(char c) {
        switch (c) {
            case 'ə':
                return 'e';
            case 'ı':
                return 'i';
            case 'ş':
                return 's';
            case 'ç':
                return 'c';
            case 'ğ':
                return 'g';
            case 'ö':
                return 'o';
            case 'ü':
                return 'u';
            default:
                return c;
        }
    }
}
