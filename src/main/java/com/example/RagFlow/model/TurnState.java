package com.example.RagFlow.model;

/**
 * Lifecycle of one turn. REJECTED and every state before USER_MESSAGE_PERSISTED
 * leave nothing behind; COMPLETED and FAILED are terminal.
 */
public enum TurnState {
    PENDING,
    VALIDATING,
    REJECTED,
    SESSION_BINDING,
    USER_MESSAGE_PERSISTED,
    EXECUTING,
    COMPLETED,
    FAILED
}
