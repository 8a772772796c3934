package com.courtrag.service.ingestion;

import com.courtrag.config.CourtRagProperties;
import com.courtrag.dto.request.DocumentSubmission;
import com.courtrag.dto.response.DocumentView;
import com.courtrag.dto.response.IngestionReport;
import com.courtrag.exception.CourtRagException;
import com.courtrag.exception.DocumentNotFoundException;
import com.courtrag.exception.EmbeddingException;
import com.courtrag.model.CourtDocument;
import com.courtrag.model.DecisionType;
import com.courtrag.model.DocumentChunk;
import com.courtrag.model.IndexedDocument;
import com.courtrag.model.MetadataField;
import com.courtrag.model.MetadataRecord;
import com.courtrag.service.embedding.EmbeddingGateway;
import com.courtrag.service.extraction.MetadataExtractor;
import com.courtrag.service.index.FacetCache;
import com.courtrag.service.index.VectorIndex;
import com.courtrag.util.TextChunker;
import com.courtrag.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns submitted documents into published index entries.
 *
 * <p>Everything up to the embedded chunk set is built off to the side; the
 * entry then becomes visible through a single {@link VectorIndex#publish}.
 * Publications of one document id are serialized, and an ingestion that
 * started before the live one is discarded. Metadata corrections keep the
 * live entry's sequence; an ingestion that was already running when a
 * correction landed re-applies it on publish.</p>
 */
@Slf4j
@Service
public class IngestionService {

    private static final String UNKNOWN_FILENAME = "unknown";
    private static final int LOCK_STRIPES = 64;

    private final TextNormalizer textNormalizer;
    private final MetadataExtractor metadataExtractor;
    private final TextChunker textChunker;
    private final EmbeddingGateway embeddingGateway;
    private final VectorIndex vectorIndex;
    private final FacetCache facetCache;
    private final DocumentRepository documentRepository;
    private final CourtRagProperties properties;
    private final ExecutorService ingestionExecutor;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock[] documentLocks = Stream.generate(ReentrantLock::new)
        .limit(LOCK_STRIPES)
        .toArray(ReentrantLock[]::new);

    // guarded by the document lock
    private final Map<String, List<CorrectionStamp>> pendingCorrections = new ConcurrentHashMap<>();

    public IngestionService(TextNormalizer textNormalizer,
                            MetadataExtractor metadataExtractor,
                            TextChunker textChunker,
                            EmbeddingGateway embeddingGateway,
                            VectorIndex vectorIndex,
                            FacetCache facetCache,
                            DocumentRepository documentRepository,
                            CourtRagProperties properties,
                            @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
                            Clock clock) {
        this.textNormalizer = textNormalizer;
        this.metadataExtractor = metadataExtractor;
        this.textChunker = textChunker;
        this.embeddingGateway = embeddingGateway;
        this.vectorIndex = vectorIndex;
        this.facetCache = facetCache;
        this.documentRepository = documentRepository;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    // ============================================================
    // Ingestion
    // ============================================================

    public IngestionReport ingest(DocumentSubmission submission) {
        long ticket = sequence.incrementAndGet();

        String rawText = submission.getText() == null ? "" : submission.getText();
        String filename = isBlank(submission.getFilename()) ? UNKNOWN_FILENAME : submission.getFilename().trim();
        String documentId = isBlank(submission.getId()) ? deriveId(filename, rawText) : submission.getId().trim();

        log.info("Ingesting {} ({}), seq {}", documentId, filename, ticket);

        String normalized = textNormalizer.normalize(rawText);
        MetadataRecord metadata = metadataExtractor.extract(normalized);
        List<String> pieces = textChunker.chunk(normalized);

        List<String> warnings = new ArrayList<>();
        List<DocumentChunk> chunks = new ArrayList<>();
        for (int i = 0; i < pieces.size(); i++) {
            String piece = pieces.get(i);
            String chunkId = DocumentChunk.chunkId(documentId, i);
            if (piece.isBlank()) {
                warnings.add("Chunk " + chunkId + " is blank and was skipped");
                continue;
            }
            try {
                float[] vector = embeddingGateway.embed(piece);
                chunks.add(DocumentChunk.of(documentId, i, piece, vector, metadata));
            } catch (EmbeddingException e) {
                log.warn("Skipping chunk {}: {}", chunkId, e.getMessage());
                warnings.add("Chunk " + chunkId + " skipped: " + e.getMessage());
            }
        }

        CourtDocument document = CourtDocument.builder()
            .id(documentId)
            .rawText(rawText)
            .normalizedText(normalized)
            .metadata(metadata)
            .ingestedAt(clock.instant())
            .sourceFilename(filename)
            .build();

        IndexedDocument entry = new IndexedDocument(documentId, metadata, filename, document.getIngestedAt(),
            ticket, TextChunker.truncate(normalized, properties.getExcerptChars()), chunks);

        Publication publication = withDocumentLock(documentId, () -> publish(entry, document));
        PublishResult result = publication.result();
        MetadataRecord published = publication.metadata();

        if (result == PublishResult.SUPERSEDED) {
            warnings.add("A newer ingestion of " + documentId + " is already live; this one was discarded");
        }

        IngestionReport report = IngestionReport.builder()
            .documentId(documentId)
            .sourceFilename(filename)
            .indexedChunks(chunks.size())
            .skippedChunks(pieces.size() - chunks.size())
            .totalChunks(pieces.size())
            .warnings(warnings)
            .metadata(published.toView())
            .superseded(result == PublishResult.SUPERSEDED)
            .replacedExisting(result == PublishResult.REPLACED)
            .build();

        log.info("Ingested {}: {} indexed, {} skipped, {} known fields",
            documentId, report.getIndexedChunks(), report.getSkippedChunks(), published.knownFieldCount());
        return report;
    }

    /**
     * Ingest documents concurrently. A document that fails is reported in its
     * own report; the others are unaffected.
     */
    public List<IngestionReport> ingestAll(List<DocumentSubmission> submissions) {
        log.info("Batch ingestion of {} documents", submissions.size());

        List<CompletableFuture<IngestionReport>> futures = new ArrayList<>();
        for (DocumentSubmission submission : submissions) {
            CompletableFuture<IngestionReport> future;
            try {
                future = CompletableFuture.supplyAsync(() -> ingest(submission), ingestionExecutor)
                    .exceptionally(e -> failedReport(submission, e));
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(failedReport(submission, e));
            }
            futures.add(future);
        }

        List<IngestionReport> reports = futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());

        long failed = reports.stream().filter(IngestionReport::isFailed).count();
        log.info("Batch ingestion finished: {} ok, {} failed", reports.size() - failed, failed);
        return reports;
    }

    // ============================================================
    // Maintenance
    // ============================================================

    public void delete(String documentId) {
        withDocumentLock(documentId, () -> {
            Optional<IndexedDocument> live = vectorIndex.find(documentId);
            facetCache.replace(live.map(IndexedDocument::metadata).orElse(null), null,
                () -> vectorIndex.remove(documentId));
            Optional<CourtDocument> stored = documentRepository.deleteById(documentId);
            pendingCorrections.remove(documentId);
            if (live.isEmpty() && stored.isEmpty()) {
                throw new DocumentNotFoundException(documentId);
            }
            log.info("Deleted {}", documentId);
            return null;
        });
    }

    /**
     * Apply metadata corrections: the index entry is re-published with the new
     * snapshot on every chunk (embeddings are reused), then the stored document
     * is updated. The corrections are also kept for any ingestion of the same
     * document that is still running.
     *
     * @throws DocumentNotFoundException when the document is not indexed
     * @throws IllegalArgumentException  when a corrected value is invalid
     */
    public DocumentView correctMetadata(String documentId, Map<MetadataField, String> corrections) {
        Map<MetadataField, String> checked = validateCorrections(corrections);

        return withDocumentLock(documentId, () -> {
            IndexedDocument current = vectorIndex.find(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
            CourtDocument document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

            MetadataRecord corrected = applyCorrections(document.getMetadata(), checked, true);
            IndexedDocument restamped = current.withMetadata(corrected);

            facetCache.replace(current.metadata(), corrected, () -> vectorIndex.publish(restamped));
            pendingCorrections.computeIfAbsent(documentId, id -> new ArrayList<>())
                .add(new CorrectionStamp(sequence.incrementAndGet(), checked));
            // index already carries the correction; the store catches up on the next line
            log.info("Metadata of {} corrected ({} fields); index re-stamped before store update",
                documentId, checked.size());
            CourtDocument updated = document.withMetadata(corrected);
            documentRepository.save(updated);

            return toView(updated, restamped);
        });
    }

    /**
     * Re-apply stored metadata to every index entry and rebuild the facet cache
     * from scratch.
     */
    public Map<String, Object> reindex() {
        log.info("Reindex started");
        int restamped = 0;

        for (IndexedDocument entry : vectorIndex.entries()) {
            if (withDocumentLock(entry.documentId(), () -> restampFromStore(entry.documentId()))) {
                restamped++;
            }
        }

        facetCache.rebuild(() -> vectorIndex.entries().stream()
            .map(IndexedDocument::metadata)
            .collect(Collectors.toList()));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("documents", vectorIndex.size());
        result.put("restamped", restamped);
        log.info("Reindex finished: {}", result);
        return result;
    }

    public Optional<CourtDocument> find(String documentId) {
        return documentRepository.findById(documentId);
    }

    public DocumentView view(String documentId) {
        CourtDocument document = documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return toView(document, vectorIndex.find(documentId).orElse(null));
    }

    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("documents", documentRepository.count());
        stats.put("indexedDocuments", vectorIndex.size());
        stats.put("indexedChunks", vectorIndex.chunkCount());

        Map<String, Integer> facetSizes = new LinkedHashMap<>();
        for (MetadataField field : MetadataField.values()) {
            facetSizes.put(field.getKey(), facetCache.size(field));
        }
        stats.put("facetValues", facetSizes);
        return stats;
    }

    // ============================================================
    // Helpers
    // ============================================================

    private Publication publish(IndexedDocument entry, CourtDocument document) {
        Optional<IndexedDocument> live = vectorIndex.find(entry.documentId());
        if (live.isPresent() && live.get().sequence() > entry.sequence()) {
            log.info("Ingestion of {} (seq {}) superseded by live seq {}",
                entry.documentId(), entry.sequence(), live.get().sequence());
            return new Publication(PublishResult.SUPERSEDED, entry.metadata());
        }

        MetadataRecord metadata = reapplyCorrections(entry.documentId(), entry.sequence(), entry.metadata());
        IndexedDocument published = metadata.equals(entry.metadata()) ? entry : entry.withMetadata(metadata);

        facetCache.replace(live.map(IndexedDocument::metadata).orElse(null), metadata,
            () -> vectorIndex.publish(published));
        documentRepository.save(document.withMetadata(metadata));

        return new Publication(live.isPresent() ? PublishResult.REPLACED : PublishResult.NEW, metadata);
    }

    /**
     * Corrections made after this ingestion took its ticket are applied to the
     * freshly extracted metadata; older ones belong to replaced content and are
     * dropped.
     */
    private MetadataRecord reapplyCorrections(String documentId, long ticket, MetadataRecord extracted) {
        List<CorrectionStamp> stamps = pendingCorrections.get(documentId);
        if (stamps == null) {
            return extracted;
        }
        stamps.removeIf(stamp -> stamp.ticket() < ticket);
        if (stamps.isEmpty()) {
            pendingCorrections.remove(documentId);
            return extracted;
        }

        MetadataRecord metadata = extracted;
        for (CorrectionStamp stamp : stamps) {
            metadata = applyCorrections(metadata, stamp.corrections(), false);
        }
        log.info("Re-applied {} metadata corrections to {} (seq {})", stamps.size(), documentId, ticket);
        return metadata;
    }

    private boolean restampFromStore(String documentId) {
        Optional<IndexedDocument> live = vectorIndex.find(documentId);
        Optional<CourtDocument> stored = documentRepository.findById(documentId);
        if (live.isEmpty() || stored.isEmpty() || stored.get().getMetadata().equals(live.get().metadata())) {
            return false;
        }

        IndexedDocument restamped = live.get().withMetadata(stored.get().getMetadata());
        facetCache.replace(live.get().metadata(), restamped.metadata(), () -> vectorIndex.publish(restamped));
        return true;
    }

    private <T> T withDocumentLock(String documentId, Supplier<T> action) {
        ReentrantLock lock = documentLocks[Math.floorMod(documentId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Map<MetadataField, String> validateCorrections(Map<MetadataField, String> corrections) {
        if (corrections == null || corrections.isEmpty()) {
            throw new IllegalArgumentException("No metadata corrections given");
        }

        Map<MetadataField, String> checked = new EnumMap<>(MetadataField.class);
        corrections.forEach((field, raw) -> {
            String value = raw == null ? "" : raw.trim();
            boolean clearing = value.isEmpty() || MetadataRecord.UNKNOWN.equalsIgnoreCase(value);
            if (!clearing) {
                switch (field) {
                    case YEAR:
                        if (!value.matches("\\d{4}") || Integer.parseInt(value) < 1900
                                || Integer.parseInt(value) > LocalDate.now(clock).getYear() + 1) {
                            throw new IllegalArgumentException("Invalid year: " + value);
                        }
                        break;
                    case DECISION_TYPE:
                        String typed = value;
                        value = DecisionType.fromText(typed)
                            .filter(type -> TextNormalizer.foldOcr(type.getLabel()).equals(TextNormalizer.foldOcr(typed)))
                            .map(DecisionType::getLabel)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown decision type: " + raw));
                        break;
                    case DECISION_DATE:
                        try {
                            LocalDate.parse(value);
                        } catch (DateTimeParseException e) {
                            throw new IllegalArgumentException("Decision date must be yyyy-MM-dd: " + value, e);
                        }
                        break;
                    default:
                        break;
                }
            }
            checked.put(field, clearing ? null : value);
        });
        return checked;
    }

    /**
     * @param strict reject a year that disagrees with the decision date instead
     *               of flagging the dating as ambiguous
     */
    private MetadataRecord applyCorrections(MetadataRecord original, Map<MetadataField, String> corrections,
                                            boolean strict) {
        MetadataRecord.Builder builder = original.toBuilder();
        corrections.forEach(builder::set);

        MetadataRecord corrected = builder.build();
        boolean datingCorrected = corrections.containsKey(MetadataField.YEAR)
            || corrections.containsKey(MetadataField.DECISION_DATE);
        if (datingCorrected) {
            Optional<Integer> year = corrected.year();
            Optional<LocalDate> date = corrected.decisionDate();
            boolean disagree = year.isPresent() && date.isPresent() && year.get() != date.get().getYear();
            if (disagree && strict) {
                throw new IllegalArgumentException("Corrected year " + year.get()
                    + " disagrees with decision date " + date.get());
            }
            corrected = corrected.toBuilder().partiallyAmbiguous(disagree).build();
        }
        return corrected;
    }

    private DocumentView toView(CourtDocument document, IndexedDocument entry) {
        return DocumentView.builder()
            .id(document.getId())
            .sourceFilename(document.getSourceFilename())
            .ingestedAt(document.getIngestedAt())
            .metadata(document.getMetadata().toView())
            .indexedChunks(entry == null ? 0 : entry.chunks().size())
            .excerpt(entry == null
                ? TextChunker.truncate(document.getNormalizedText(), properties.getExcerptChars())
                : entry.excerpt())
            .build();
    }

    private IngestionReport failedReport(DocumentSubmission submission, Throwable error) {
        Throwable cause = error.getCause() != null && !(error instanceof CourtRagException) ? error.getCause() : error;
        log.error("Ingestion of '{}' failed: {}", submission.getFilename(), cause.getMessage(), cause);
        return IngestionReport.builder()
            .documentId(submission.getId())
            .sourceFilename(submission.getFilename())
            .error(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
            .build();
    }

    static String deriveId(String filename, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(filename.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(text.getBytes(StandardCharsets.UTF_8));
            return "doc_" + HexFormat.of().formatHex(digest.digest()).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum PublishResult {
        NEW,
        REPLACED,
        SUPERSEDED
    }

    private record Publication(PublishResult result, MetadataRecord metadata) {
    }

    private record CorrectionStamp(long ticket, Map<MetadataField, String> corrections) {
    }
}
