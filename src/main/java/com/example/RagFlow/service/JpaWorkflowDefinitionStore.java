package com.example.RagFlow.service;

import com.example.RagFlow.model.WorkflowDefinition;
import com.example.RagFlow.repository.WorkflowRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private final WorkflowRepository workflowRepository;
    private final WorkflowGraphCodec graphCodec;

    @Override
    public Optional<WorkflowDefinition> get(Long workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        return workflowRepository.findById(workflowId)
                .map(workflow -> new WorkflowDefinition(
                        workflow.getId(),
                        workflow.getName(),
                        graphCodec.readComponents(workflow.getComponentsJson()),
                        graphCodec.readConnections(workflow.getConnectionsJson())
                ));
    }
}
