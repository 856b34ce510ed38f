package com.example.RagFlow.service;

import com.example.RagFlow.model.RetrievedChunk;

import java.util.List;
import java.util.Map;

/**
 * Chunk-level similarity index over knowledge documents.
 */
public interface VectorIndex {

    /**
     * Best {@code k} chunks of one document for the query, highest score first.
     */
    List<RetrievedChunk> searchSimilar(String query, int k, Long documentId);

    /**
     * Replace every chunk stored for the document.
     *
     * @return number of chunks written
     */
    int upsert(Long documentId, List<String> chunks, Map<String, Object> metadata);

    void deleteByDocument(Long documentId);
}
