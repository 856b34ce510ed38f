package com.example.RagFlow.model;

/**
 * @param workflowId workflow to run
 * @param query      user question for this turn
 * @param sessionId  existing chat session; a new one is created when absent
 */
public record WorkflowExecuteRequest(
        Long workflowId,
        String query,
        Long sessionId
) {
}
