package com.example.RagFlow.service;

import com.example.RagFlow.model.BoundDocument;
import com.example.RagFlow.repository.KnowledgeDocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

    private final KnowledgeDocumentRepository documentRepository;

    @Override
    public List<BoundDocument> listByWorkflow(Long workflowId) {
        return documentRepository.findByWorkflowIdOrderByIdAsc(workflowId).stream()
                .map(doc -> new BoundDocument(doc.getId(), doc.getFilename()))
                .toList();
    }
}
