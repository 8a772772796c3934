package com.courtrag.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

/**
 * Field key to corrected value; {@code "unknown"} or an empty value clears the field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataCorrectionRequest {

    @NotEmpty
    private Map<String, String> corrections = new LinkedHashMap<>();
}
