package com.example.RagFlow.exception;

public class ResourceNotFoundException extends WorkflowException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static ResourceNotFoundException workflow(Long workflowId) {
        return new ResourceNotFoundException("Workflow " + workflowId + " not found");
    }

    public static ResourceNotFoundException session(Long sessionId) {
        return new ResourceNotFoundException("Chat session " + sessionId + " not found");
    }

    public static ResourceNotFoundException document(Long documentId) {
        return new ResourceNotFoundException("Document " + documentId + " not found");
    }
}
