package com.example.RagFlow.repository;

import com.example.RagFlow.model.KnowledgeDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, Long> {

    List<KnowledgeDocument> findByWorkflowIdOrderByIdAsc(Long workflowId);
}
