package com.courtrag.service.embedding;

/**
 * Text to fixed-dimension vector. Implementations may fail or hang; callers go
 * through {@link EmbeddingGateway}.
 */
@FunctionalInterface
public interface EmbeddingClient {

    float[] embed(String text);
}
