package com.example.RagFlow.model;

import java.util.Map;

public record WorkflowExecuteResponse(
        String response,
        Long sessionId,
        long executionTimeMs,
        Map<String, Object> metadata
) {
}
