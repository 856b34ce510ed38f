package com.example.RagFlow.engine;

import com.example.RagFlow.model.ModelOutput;
import com.example.RagFlow.model.TurnOutput;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Values passed between components during one turn. Created per execution and dropped when the
 * turn ends; nothing here is persisted directly.
 */
@Getter
@Setter
public class ExecutionContext {

    private final Long workflowId;
    private final String turnQuery;
    private final TurnDeadline deadline;

    private String query;

    /** Knowledge-base text for the prompt; null until a knowledge base component ran. */
    private String retrievedText;

    /** Source filenames; null until a knowledge base component ran. */
    private List<String> sources;

    private ModelOutput modelOutput;

    /** Set by the first output component that has a model answer; later components are skipped. */
    private TurnOutput output;

    public ExecutionContext(Long workflowId, String turnQuery, TurnDeadline deadline) {
        this.workflowId = workflowId;
        this.turnQuery = turnQuery;
        this.deadline = deadline;
        this.query = turnQuery;
    }

    public boolean isCompleted() {
        return output != null;
    }
}
