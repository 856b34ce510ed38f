package com.example.RagFlow.model;

import java.time.Instant;
import java.util.List;

public record WorkflowResponse(
        Long id,
        String name,
        String description,
        List<WorkflowComponent> components,
        List<Connection> connections,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
}
