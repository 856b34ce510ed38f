package com.example.RagFlow.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Directed edge between two components. Older records spell the endpoints
 * {@code source_id}/{@code target_id}; both spellings are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection(
        String id,
        @JsonAlias("source_id") String source,
        @JsonAlias("target_id") String target,
        String sourceHandle,
        String targetHandle
) {
    public static Connection of(String source, String target) {
        return new Connection(null, source, target, null, null);
    }
}
