package com.courtrag.service.embedding;

import com.courtrag.config.EmbeddingConfig;
import com.courtrag.exception.EmbeddingException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Resilient access to the {@link EmbeddingClient}: every attempt runs on the
 * embedding executor under a {@link TimeLimiter}, failed attempts are retried
 * by a {@link Retry}, and exhaustion surfaces as {@link EmbeddingException}.
 */
@Slf4j
@Service
public class EmbeddingGateway {

    static final String INSTANCE = "embedding";

    private final EmbeddingClient client;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final int dimension;

    @Autowired
    public EmbeddingGateway(EmbeddingClient client,
                            RetryRegistry retryRegistry,
                            TimeLimiterRegistry timeLimiterRegistry,
                            @Qualifier("embeddingExecutor") ExecutorService executor,
                            EmbeddingConfig embeddingConfig) {
        this(client, retryRegistry.retry(INSTANCE), timeLimiterRegistry.timeLimiter(INSTANCE),
            executor, embeddingConfig.getDimension());
    }

    public EmbeddingGateway(EmbeddingClient client, Retry retry, TimeLimiter timeLimiter,
                            ExecutorService executor, int dimension) {
        this.client = client;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
        this.dimension = dimension;

        this.retry.getEventPublisher().onRetry(event ->
            log.warn("Embedding attempt {} failed, retrying: {}",
                event.getNumberOfRetryAttempts(), describe(event.getLastThrowable())));
    }

    /**
     * Embed one text.
     *
     * @throws EmbeddingException when every attempt failed or timed out, or the
     *                            vector has the wrong dimension
     */
    public float[] embed(String text) {
        Callable<float[]> attempt = timeLimiter.decorateFutureSupplier(
            () -> CompletableFuture.supplyAsync(() -> client.embed(text), executor));
        Callable<float[]> withRetry = Retry.decorateCallable(retry, attempt);

        float[] vector;
        try {
            vector = withRetry.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while embedding", e);
        } catch (Exception e) {
            int attempts = retry.getRetryConfig().getMaxAttempts();
            throw new EmbeddingException("Embedding failed after " + attempts + " attempts: " + describe(e), e);
        }

        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding service returned an empty vector");
        }
        if (dimension > 0 && vector.length != dimension) {
            throw new EmbeddingException(String.format(
                "Embedding dimension mismatch: expected %d, got %d", dimension, vector.length));
        }
        return vector;
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        if (t instanceof TimeoutException) {
            return "timed out";
        }
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
