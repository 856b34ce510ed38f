package com.example.RagFlow.exception;

/**
 * Base class for failures raised by the workflow engine. The {@link ErrorKind}
 * decides how the failure is recorded in chat history and reported over HTTP.
 */
public class WorkflowException extends RuntimeException {

    private final ErrorKind kind;

    public WorkflowException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WorkflowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
