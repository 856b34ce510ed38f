package com.example.RagFlow.model;

import java.util.List;

/**
 * Create/update payload for a workflow. On update, null fields are left unchanged.
 */
public record WorkflowRequest(
        String name,
        String description,
        List<WorkflowComponent> components,
        List<Connection> connections,
        Boolean active
) {
}
