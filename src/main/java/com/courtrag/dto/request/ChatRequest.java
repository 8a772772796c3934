package com.courtrag.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRequest {

    /** Omit to start a new conversation. */
    private String conversationId;

    @NotNull
    private String message;

    @Min(1)
    private Integer limit;
}
