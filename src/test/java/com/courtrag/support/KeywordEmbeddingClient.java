package com.courtrag.support;

import com.courtrag.service.embedding.EmbeddingClient;
import com.courtrag.util.TextNormalizer;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Bag-of-keywords embedding: one dimension per vocabulary word, counting its
 * occurrences in the OCR-folded text. Texts containing {@link #FAILURE_MARKER}
 * always fail.
 */
public class KeywordEmbeddingClient implements EmbeddingClient {

    public static final String FAILURE_MARKER = "XƏTA";

    private final List<String> vocabulary;
    private final AtomicInteger calls = new AtomicInteger();

    public KeywordEmbeddingClient(String... vocabulary) {
        this.vocabulary = List.of(vocabulary).stream()
            .map(TextNormalizer::foldOcr)
            .collect(Collectors.toList());
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        if (text.contains(FAILURE_MARKER)) {
            throw new IllegalStateException("embedding backend failed");
        }
        String folded = TextNormalizer.foldOcr(text);
        float[] vector = new float[vocabulary.size()];
        for (int i = 0; i < vocabulary.size(); i++) {
            vector[i] = occurrences(folded, vocabulary.get(i));
        }
        return vector;
    }

    public float[] vectorOf(String text) {
        return embed(text);
    }

    public int getCalls() {
        return calls.get();
    }

    private static int occurrences(String text, String word) {
        int count = 0;
        int from = text.indexOf(word);
        while (from >= 0) {
            count++;
            from = text.indexOf(word, from + word.length());
        }
        return count;
    }
}
