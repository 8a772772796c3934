package com.courtrag.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A document handed over by intake: text already extracted from its file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentSubmission {

    /** Optional; derived from filename and text when absent. */
    @Size(max = 200)
    private String id;

    private String filename;

    @NotNull
    private String text;
}
