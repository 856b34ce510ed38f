package com.example.RagFlow.exception;

import java.util.List;

public class WorkflowValidationException extends WorkflowException {

    private final List<String> errors;

    public WorkflowValidationException(List<String> errors) {
        super(ErrorKind.VALIDATION, "Invalid workflow: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
