package com.courtrag.service.embedding;

import com.courtrag.config.EmbeddingConfig;
import com.courtrag.exception.EmbeddingException;
import com.courtrag.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.*;

/**
 * Calls the embedding service: {@code POST /embed {"texts": [...]}} answering
 * {@code {"embeddings": [[...]]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteEmbeddingClient implements EmbeddingClient {

    private final EmbeddingConfig embeddingConfig;
    private final WebClient embeddingWebClient;

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Text is empty");
        }

        log.debug("Calling embedding service for {} chars", text.length());

        Map<String, Object> response;
        try {
            response = embeddingWebClient.post()
                .uri("/embed")
                .bodyValue(Map.of("texts", List.of(text)))
                .retrieve()
                .bodyToMono(Map.class)
                .block(Duration.ofSeconds(embeddingConfig.getTimeoutSeconds()));
        } catch (RuntimeException e) {
            throw new EmbeddingException("Embedding service call failed: " + e.getMessage(), e);
        }

        if (response == null || !response.containsKey("embeddings")) {
            throw new EmbeddingException("Invalid response from embedding service");
        }

        @SuppressWarnings("unchecked")
        List<List<Number>> embeddings = (List<List<Number>>) response.get("embeddings");

        if (embeddings == null || embeddings.isEmpty() || embeddings.get(0) == null) {
            throw new EmbeddingException("Empty embedding response");
        }

        return VectorMath.toFloatArray(embeddings.get(0));
    }
}
