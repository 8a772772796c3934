package com.courtrag.service.dialogue;

public enum ConversationPhase {
    AWAITING_QUERY,
    AWAITING_CLARIFICATION,
    READY_TO_SEARCH
}
