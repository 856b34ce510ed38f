package com.example.RagFlow.service;

import com.example.RagFlow.model.WorkflowDefinition;

import java.util.Optional;

public interface WorkflowDefinitionStore {

    Optional<WorkflowDefinition> get(Long workflowId);
}
