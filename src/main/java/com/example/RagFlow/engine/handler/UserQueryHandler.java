package com.example.RagFlow.engine.handler;

import com.example.RagFlow.engine.ComponentConfig;
import com.example.RagFlow.engine.ComponentHandler;
import com.example.RagFlow.engine.ExecutionCollaborators;
import com.example.RagFlow.engine.ExecutionContext;
import com.example.RagFlow.model.ComponentType;
import org.springframework.stereotype.Component;

/**
 * Entry point of a workflow: hands the turn's query to downstream components verbatim.
 */
@Component
public class UserQueryHandler implements ComponentHandler {

    @Override
    public String type() {
        return ComponentType.USER_QUERY.wireName();
    }

    @Override
    public void execute(ExecutionContext context, ComponentConfig config, ExecutionCollaborators collaborators) {
        context.setQuery(context.getTurnQuery());
    }
}
