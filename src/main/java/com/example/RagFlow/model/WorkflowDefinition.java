package com.example.RagFlow.model;

import java.util.List;

/**
 * Immutable snapshot of a stored workflow, handed to the engine per execution.
 * Component order only matters for display.
 */
public record WorkflowDefinition(
        Long id,
        String name,
        List<WorkflowComponent> components,
        List<Connection> connections
) {
    public WorkflowDefinition {
        components = components == null ? List.of() : List.copyOf(components);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
