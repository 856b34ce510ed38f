package com.example.RagFlow.service;

import com.example.RagFlow.exception.UpstreamFailureException;
import com.example.RagFlow.model.RetrievedChunk;
import com.example.RagFlow.repository.DocumentChunkVectorRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Vector index backed by pgvector:
 * - Embeds the query (or chunks) with the configured EmbeddingModel
 * - Reads/writes the {@code document_chunks} table
 * <p>
 * Embedding or database errors surface as {@link UpstreamFailureException}; retrieval is not retried.
 */
@Service
@RequiredArgsConstructor
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    private final EmbeddingModel embeddingModel;
    private final DocumentChunkVectorRepository chunkRepository;
    private final ObjectMapper objectMapper;

    @Override
    public List<RetrievedChunk> searchSimilar(String query, int k, Long documentId) {
        try {
            float[] queryEmbedding = embeddingModel.embed(query);
            List<RetrievedChunk> chunks = chunkRepository.findNearest(queryEmbedding, k, documentId);
            log.debug("Similarity search returned {} chunk(s) for document {}", chunks.size(), documentId);
            return chunks;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException(
                    "Similarity search failed for document " + documentId + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Drops the document's previous chunks, then embeds and stores the new ones.
     */
    @Override
    public int upsert(Long documentId, List<String> chunks, Map<String, Object> metadata) {
        if (chunks == null || chunks.isEmpty()) {
            return 0;
        }
        String metadataJson = serializeMetadata(metadata);
        try {
            chunkRepository.deleteByDocument(documentId);
            List<float[]> embeddings = embeddingModel.embed(chunks);
            int written = chunkRepository.insertChunks(documentId, chunks, embeddings, metadataJson);
            log.info("Indexed {} chunk(s) for document {}", written, documentId);
            return written;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Indexing failed for document " + documentId + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void deleteByDocument(Long documentId) {
        int removed = chunkRepository.deleteByDocument(documentId);
        log.debug("Removed {} chunk(s) for document {}", removed, documentId);
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Chunk metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
