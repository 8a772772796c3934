package com.courtrag.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchRequest {

    private String query;

    /** Field key (e.g. {@code judge}, {@code year}) to required value. */
    @Builder.Default
    private Map<String, String> filters = new LinkedHashMap<>();

    @Min(1)
    @Max(1000)
    private Integer limit;

    @Min(0)
    private Integer offset;
}
