package com.example.RagFlow.repository;

import com.example.RagFlow.model.ChatSession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {

    List<ChatSession> findByWorkflowIdOrderByIdAsc(Long workflowId, Pageable pageable);

    List<ChatSession> findByWorkflowId(Long workflowId);
}
