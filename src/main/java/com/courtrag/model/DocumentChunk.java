package com.courtrag.model;

/**
 * Contiguous slice of a document's normalized text together with its embedding
 * and a snapshot of the document metadata taken at index time.
 */
public record DocumentChunk(
        String id,
        String documentId,
        int sequence,
        String text,
        float[] embedding,
        MetadataRecord metadata
) {

    public static String chunkId(String documentId, int sequence) {
        return documentId + "#" + sequence;
    }

    public static DocumentChunk of(String documentId, int sequence, String text, float[] embedding,
                                   MetadataRecord metadata) {
        return new DocumentChunk(chunkId(documentId, sequence), documentId, sequence, text, embedding, metadata);
    }

    public DocumentChunk withMetadata(MetadataRecord snapshot) {
        return new DocumentChunk(id, documentId, sequence, text, embedding, snapshot);
    }
}
