package com.courtrag.dto.response;

public enum SearchStatus {
    OK,
    NO_MATCHES,
    NO_SUFFICIENTLY_RELEVANT,
    TIMEOUT,
    EMBEDDING_UNAVAILABLE
}
