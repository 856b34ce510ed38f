package com.example.RagFlow.engine;

/**
 * Executes one component type. Handlers read and write the shared {@link ExecutionContext};
 * collaborator failures surface as {@link com.example.RagFlow.exception.WorkflowException}s.
 */
public interface ComponentHandler {

    /**
     * Component type name this handler serves, e.g. "knowledge_base".
     */
    String type();

    void execute(ExecutionContext context, ComponentConfig config, ExecutionCollaborators collaborators);
}
