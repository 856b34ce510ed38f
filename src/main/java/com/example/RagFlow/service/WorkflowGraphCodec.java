package com.example.RagFlow.service;

import com.example.RagFlow.model.Connection;
import com.example.RagFlow.model.WorkflowComponent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON form of the graph columns on {@link com.example.RagFlow.model.Workflow}.
 */
@Component
@RequiredArgsConstructor
public class WorkflowGraphCodec {

    private static final TypeReference<List<WorkflowComponent>> COMPONENTS = new TypeReference<>() { };
    private static final TypeReference<List<Connection>> CONNECTIONS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public String writeComponents(List<WorkflowComponent> components) {
        return write(components == null ? List.of() : components);
    }

    public String writeConnections(List<Connection> connections) {
        return write(connections == null ? List.of() : connections);
    }

    public List<WorkflowComponent> readComponents(String json) {
        return read(json, COMPONENTS);
    }

    public List<Connection> readConnections(String json) {
        return read(json, CONNECTIONS);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow graph could not be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> values = objectMapper.readValue(json, type);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored workflow graph is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
