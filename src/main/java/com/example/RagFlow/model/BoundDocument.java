package com.example.RagFlow.model;

/**
 * A knowledge document bound to a workflow, as seen by the engine.
 */
public record BoundDocument(Long id, String filename) {
}
