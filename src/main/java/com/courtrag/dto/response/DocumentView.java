package com.courtrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentView {

    private String id;

    private String sourceFilename;

    private Instant ingestedAt;

    private Map<String, Object> metadata;

    private int indexedChunks;

    private String excerpt;
}
