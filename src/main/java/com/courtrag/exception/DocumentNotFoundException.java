package com.courtrag.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends CourtRagException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
