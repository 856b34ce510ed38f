package com.example.RagFlow.service;

import com.example.RagFlow.engine.GraphValidator;
import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.KnowledgeDocument;
import com.example.RagFlow.model.ValidationResult;
import com.example.RagFlow.model.Workflow;
import com.example.RagFlow.model.WorkflowRequest;
import com.example.RagFlow.model.WorkflowResponse;
import com.example.RagFlow.repository.ChatMessageRepository;
import com.example.RagFlow.repository.ChatSessionRepository;
import com.example.RagFlow.repository.KnowledgeDocumentRepository;
import com.example.RagFlow.repository.WorkflowRepository;
import com.example.RagFlow.util.OffsetPaging;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stored workflow management. Saving never validates; validation is a separate call so
 * partially built graphs can be kept.
 */
@Service
@RequiredArgsConstructor
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowRepository workflowRepository;
    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final KnowledgeDocumentRepository documentRepository;
    private final VectorIndex vectorIndex;
    private final WorkflowGraphCodec graphCodec;
    private final GraphValidator graphValidator;

    public WorkflowResponse create(WorkflowRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Workflow name must not be blank");
        }
        Workflow workflow = new Workflow();
        workflow.setName(request.name().trim());
        workflow.setDescription(request.description());
        workflow.setComponentsJson(graphCodec.writeComponents(request.components()));
        workflow.setConnectionsJson(graphCodec.writeConnections(request.connections()));
        workflow.setActive(request.active() == null || request.active());
        return toResponse(workflowRepository.save(workflow));
    }

    public WorkflowResponse get(Long workflowId) {
        return toResponse(load(workflowId));
    }

    public List<WorkflowResponse> list(int skip, int limit) {
        List<Workflow> workflows = OffsetPaging.slice(skip, limit, Sort.by("id"),
                page -> workflowRepository.findAll(page).getContent());
        return workflows.stream()
                .map(this::toResponse)
                .toList();
    }

    public WorkflowResponse update(Long workflowId, WorkflowRequest request) {
        Workflow workflow = load(workflowId);
        if (request.name() != null && !request.name().isBlank()) {
            workflow.setName(request.name().trim());
        }
        if (request.description() != null) {
            workflow.setDescription(request.description());
        }
        if (request.components() != null) {
            workflow.setComponentsJson(graphCodec.writeComponents(request.components()));
        }
        if (request.connections() != null) {
            workflow.setConnectionsJson(graphCodec.writeConnections(request.connections()));
        }
        if (request.active() != null) {
            workflow.setActive(request.active());
        }
        return toResponse(workflowRepository.save(workflow));
    }

    /**
     * Removes the workflow with its chat sessions, messages, bound documents and their vectors.
     */
    @Transactional
    public void delete(Long workflowId) {
        Workflow workflow = load(workflowId);

        for (ChatSession session : sessionRepository.findByWorkflowId(workflowId)) {
            messageRepository.deleteBySessionId(session.getId());
            sessionRepository.delete(session);
        }
        for (KnowledgeDocument document : documentRepository.findByWorkflowIdOrderByIdAsc(workflowId)) {
            vectorIndex.deleteByDocument(document.getId());
            documentRepository.delete(document);
        }
        workflowRepository.delete(workflow);
        log.info("Deleted workflow {}", workflowId);
    }

    public ValidationResult validate(Long workflowId) {
        Workflow workflow = load(workflowId);
        return graphValidator.validate(
                graphCodec.readComponents(workflow.getComponentsJson()),
                graphCodec.readConnections(workflow.getConnectionsJson())
        );
    }

    private Workflow load(Long workflowId) {
        return workflowRepository.findById(workflowId)
                .orElseThrow(() -> ResourceNotFoundException.workflow(workflowId));
    }

    private WorkflowResponse toResponse(Workflow workflow) {
        return new WorkflowResponse(
                workflow.getId(),
                workflow.getName(),
                workflow.getDescription(),
                graphCodec.readComponents(workflow.getComponentsJson()),
                graphCodec.readConnections(workflow.getConnectionsJson()),
                workflow.isActive(),
                workflow.getCreatedAt(),
                workflow.getUpdatedAt()
        );
    }
}
