package com.example.RagFlow.model;

import java.time.Instant;
import java.util.List;

public record ChatSessionResponse(
        Long id,
        Long workflowId,
        String sessionName,
        Instant createdAt,
        List<ChatMessageResponse> messages
) {
}
