package com.example.RagFlow.exception;

/**
 * A retrieval or generation collaborator failed while a turn was running.
 */
public class UpstreamFailureException extends WorkflowException {

    public UpstreamFailureException(String message) {
        super(ErrorKind.UPSTREAM_FAILURE, message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_FAILURE, message, cause);
    }
}
