package com.courtrag.support;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;
import com.courtrag.model.MetadataRecord;
import com.courtrag.service.embedding.EmbeddingClient;
import com.courtrag.service.embedding.EmbeddingGateway;
import com.courtrag.service.extraction.InstitutionCatalog;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ExecutorService;

/**
 * Shared builders for hand-wired service tests.
 */
public final class TestFixtures {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private TestFixtures() {
    }

    public static CourtRagProperties properties() {
        CourtRagProperties properties = new CourtRagProperties();
        properties.getChunking().setMaxChars(200);
        properties.getChunking().setOverlapChars(40);
        properties.getChunking().setMinOverlapChars(20);
        properties.getSearch().setTimeoutMillis(2000L);
        return properties;
    }

    public static InstitutionCatalog catalog() {
        return new InstitutionCatalog(
            List.of("Ağdam Rayon Məhkəməsi", "Şirvan Apellyasiya Məhkəməsi", "Bakı Apellyasiya Məhkəməsi",
                "Nəsimi Rayon Məhkəməsi", "Bakı Kommersiya Məhkəməsi"),
            List.of("Ağdam", "Şirvan", "Bakı", "Nəsimi"));
    }

    public static EmbeddingGateway gateway(EmbeddingClient client, ExecutorService executor) {
        return gateway(client, executor, Duration.ofSeconds(2));
    }

    public static EmbeddingGateway gateway(EmbeddingClient client, ExecutorService executor, Duration timeout) {
        Retry retry = Retry.of("embedding-test", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(10))
            .build());
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());
        return new EmbeddingGateway(client, retry, timeLimiter, executor, 0);
    }

    /**
     * Index entry with one chunk per text, embedded with the given client.
     */
    public static IndexedDocument entry(String documentId, MetadataRecord metadata, long sequence,
                                        KeywordEmbeddingClient embeddings, String... texts) {
        List<DocumentChunk> chunks = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            chunks.add(DocumentChunk.of(documentId, i, texts[i], embeddings.vectorOf(texts[i]), metadata));
        }
        String excerpt = texts.length > 0 ? texts[0] : "";
        return new IndexedDocument(documentId, metadata, documentId + ".pdf",
            FIXED_CLOCK.instant(), sequence, excerpt, chunks);
    }
}
