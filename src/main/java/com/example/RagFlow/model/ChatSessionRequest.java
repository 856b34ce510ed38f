package com.example.RagFlow.model;

public record ChatSessionRequest(Long workflowId, String sessionName) {
}
