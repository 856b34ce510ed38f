package com.example.RagFlow.service;

import com.example.RagFlow.model.BoundDocument;

import java.util.List;

public interface DocumentStore {

    /**
     * Documents bound to the workflow, in a stable order.
     */
    List<BoundDocument> listByWorkflow(Long workflowId);
}
