package com.example.RagFlow.model;

/**
 * A chunk returned by similarity search, scored as {@code 1 - cosine distance}.
 */
public record RetrievedChunk(
        Long documentId,
        int chunkIndex,
        String text,
        double score
) {
}
