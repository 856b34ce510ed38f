package com.example.RagFlow.model;

import java.time.Instant;

public record DocumentResponse(
        Long id,
        Long workflowId,
        String filename,
        String contentType,
        long fileSize,
        boolean processed,
        int chunkCount,
        Instant createdAt
) {
    public static DocumentResponse from(KnowledgeDocument document) {
        return new DocumentResponse(
                document.getId(),
                document.getWorkflowId(),
                document.getFilename(),
                document.getContentType(),
                document.getFileSize(),
                document.isProcessed(),
                document.getChunkCount(),
                document.getCreatedAt()
        );
    }
}
