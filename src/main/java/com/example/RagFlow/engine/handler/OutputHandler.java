package com.example.RagFlow.engine.handler;

import com.example.RagFlow.engine.ComponentConfig;
import com.example.RagFlow.engine.ComponentHandler;
import com.example.RagFlow.engine.ExecutionCollaborators;
import com.example.RagFlow.engine.ExecutionContext;
import com.example.RagFlow.model.ComponentType;
import com.example.RagFlow.model.ModelOutput;
import com.example.RagFlow.model.TurnOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Formats the final answer:
 *  {response, metadata: {modelInfo: {provider, model}, sources?}}
 * An output reached before any model answered produces nothing, so a later output
 * component can still finish the turn.
 */
@Component
public class OutputHandler implements ComponentHandler {

    private static final Logger log = LoggerFactory.getLogger(OutputHandler.class);

    @Override
    public String type() {
        return ComponentType.OUTPUT.wireName();
    }

    @Override
    public void execute(ExecutionContext context, ComponentConfig config, ExecutionCollaborators collaborators) {
        boolean showSources = config.getBoolean(true, "showSources", "show_sources");

        ModelOutput modelOutput = context.getModelOutput();
        if (modelOutput == null) {
            log.debug("Output reached before any model answer; turn stays open");
            return;
        }

        Map<String, Object> modelInfo = new LinkedHashMap<>();
        modelInfo.put("provider", modelOutput.provider());
        modelInfo.put("model", modelOutput.modelUsed());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("modelInfo", modelInfo);
        if (showSources && context.getSources() != null) {
            metadata.put("sources", context.getSources().stream().distinct().toList());
        }

        context.setOutput(new TurnOutput(modelOutput.text(), metadata));
    }
}
