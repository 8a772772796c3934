package com.courtrag.util;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Splits normalized text into bounded, overlapping chunks.
 *
 * <p>Units are paragraphs split into sentences. Units are joined with a single
 * space until the next one would exceed {@code maxChars}; the following chunk
 * then opens with the tail of the closed one, between {@code minOverlapChars}
 * and {@code overlapChars} long.</p>
 */
@Slf4j
@Component
@Getter
public class TextChunker {

    private static final Pattern PARAGRAPHS = Pattern.compile("\\n+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?…;])\\s+");
    private static final Pattern WORDS = Pattern.compile("\\s+");

    private final int maxChars;
    private final int overlapChars;
    private final int minOverlapChars;

    @Autowired
    public TextChunker(CourtRagProperties properties) {
        this(properties.getMaxChunkChars(), properties.getOverlapChars(), properties.getMinOverlapChars());
    }

    public TextChunker(int maxChars, int overlapChars, int minOverlapChars) {
        if (minOverlapChars <= 0 || minOverlapChars > overlapChars || overlapChars * 2 >= maxChars) {
            throw new InvalidConfigurationException(String.format(
                "Chunker needs 0 < minOverlap (%d) <= overlap (%d) < max (%d) / 2",
                minOverlapChars, overlapChars, maxChars));
        }
        this.maxChars = maxChars;
        this.overlapChars = overlapChars;
        this.minOverlapChars = minOverlapChars;
    }

    /**
     * Chunk a document. Always returns at least one element; blank input gives a
     * single empty chunk.
     */
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of("");
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String unit : units(text)) {
            if (current.length() == 0) {
                current.append(unit);
            } else if (current.length() + 1 + unit.length() <= maxChars) {
                current.append(' ').append(unit);
            } else {
                String closed = current.toString();
                chunks.add(closed);
                current.setLength(0);
                current.append(tail(closed)).append(' ').append(unit);
            }
        }

        if (current.length() > 0) {
            chunks.add(current.toString());
        }

        log.debug("Chunked {} chars into {} chunks", text.length(), chunks.size());
        return chunks;
    }

    /**
     * Sentence units, each short enough that the overlap tail, a joining space and
     * the unit still fit in one chunk.
     */
    List<String> units(String text) {
        int budget = maxChars - overlapChars - 1;
        List<String> units = new ArrayList<>();

        for (String paragraph : PARAGRAPHS.split(text)) {
            for (String sentence : SENTENCE_END.split(paragraph.strip())) {
                String unit = sentence.strip();
                if (unit.isEmpty()) {
                    continue;
                }
                if (unit.length() <= budget) {
                    units.add(unit);
                } else {
                    splitLongUnit(unit, budget, units);
                }
            }
        }
        return units;
    }

    private void splitLongUnit(String unit, int budget, List<String> out) {
        StringBuilder piece = new StringBuilder();
        for (String word : WORDS.split(unit)) {
            if (word.length() > budget) {
                if (piece.length() > 0) {
                    out.add(piece.toString());
                    piece.setLength(0);
                }
                for (int i = 0; i < word.length(); i += budget) {
                    out.add(word.substring(i, Math.min(word.length(), i + budget)));
                }
                continue;
            }
            if (piece.length() > 0 && piece.length() + 1 + word.length() > budget) {
                out.add(piece.toString());
                piece.setLength(0);
            }
            if (piece.length() > 0) {
                piece.append(' ');
            }
            piece.append(word);
        }
        if (piece.length() > 0) {
            out.add(piece.toString());
        }
    }

    /**
     * Trailing overlap of a closed chunk. The chunk is always longer than
     * {@code overlapChars} when this is called.
     */
    String tail(String chunk) {
        int start = Math.max(0, chunk.length() - overlapChars);
        String tail = chunk.substring(start);

        boolean midWord = start > 0
            && !Character.isWhitespace(chunk.charAt(start - 1))
            && !Character.isWhitespace(chunk.charAt(start));
        if (midWord) {
            int space = tail.indexOf(' ');
            if (space >= 0 && tail.length() - space - 1 >= minOverlapChars) {
                tail = tail.substring(space + 1);
            }
        }

        if (tail.startsWith(" ") && tail.length() - 1 >= minOverlapChars) {
            tail = tail.substring(1);
        }
        return tail;
    }

    /**
     * Truncate text to maximum length
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }

        return text.substring(0, maxLength).stripTrailing() + "...";
    }
}
