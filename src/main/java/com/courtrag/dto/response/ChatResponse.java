package com.courtrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String conversationId;

    private String phase;

    /** Question to show the user; null once a search ran. */
    private String prompt;

    private Map<String, String> filters;

    private String residualQuery;

    /** Field key to the values the user is asked to choose from. */
    private Map<String, List<String>> candidates;

    private SearchOutcome outcome;
}
