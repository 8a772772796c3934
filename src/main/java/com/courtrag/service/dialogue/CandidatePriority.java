package com.courtrag.service.dialogue;

/**
 * Order in which the best single guess is chosen once clarification rounds run out.
 */
public enum CandidatePriority {

    /** Most backing documents first, then the longest value. */
    DOCUMENT_COUNT,

    /** Longest value first, then the most backing documents. */
    LONGEST_MATCH
}
