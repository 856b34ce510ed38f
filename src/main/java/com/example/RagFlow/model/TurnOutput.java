package com.example.RagFlow.model;

import java.util.Map;

/**
 * Final answer of a turn as produced by an output component.
 */
public record TurnOutput(String response, Map<String, Object> metadata) {
    public TurnOutput {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
