package com.example.RagFlow.model;

import java.time.Instant;
import java.util.Map;

public record ChatMessageResponse(
        Long id,
        Long sessionId,
        String role,
        String content,
        Map<String, Object> metadata,
        Instant createdAt
) {
}
