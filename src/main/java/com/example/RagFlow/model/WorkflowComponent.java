package com.example.RagFlow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * One node of a workflow graph as stored by the editor.
 *
 * @param id       unique within its definition
 * @param type     component type name, e.g. "knowledge_base"
 * @param position editor canvas position, passed through untouched
 * @param data     handler-specific configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowComponent(
        String id,
        String type,
        Map<String, Object> position,
        Map<String, Object> data
) {
    public WorkflowComponent {
        data = data == null ? Map.of() : data;
    }

    public static WorkflowComponent of(String id, String type) {
        return new WorkflowComponent(id, type, null, Map.of());
    }

    public static WorkflowComponent of(String id, String type, Map<String, Object> data) {
        return new WorkflowComponent(id, type, null, data);
    }
}
