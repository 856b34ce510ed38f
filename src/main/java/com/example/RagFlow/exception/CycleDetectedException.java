package com.example.RagFlow.exception;

import java.util.List;

/**
 * Raised when topological ordering cannot place every component.
 */
public class CycleDetectedException extends WorkflowException {

    private final List<String> unresolvedIds;

    public CycleDetectedException(List<String> unresolvedIds) {
        super(ErrorKind.CYCLE_DETECTED, "Workflow contains a cycle; unresolved components: " + unresolvedIds);
        this.unresolvedIds = List.copyOf(unresolvedIds);
    }

    public List<String> getUnresolvedIds() {
        return unresolvedIds;
    }
}
