package com.example.RagFlow.engine.handler;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.engine.ComponentConfig;
import com.example.RagFlow.engine.ComponentHandler;
import com.example.RagFlow.engine.ExecutionCollaborators;
import com.example.RagFlow.engine.ExecutionContext;
import com.example.RagFlow.exception.UpstreamFailureException;
import com.example.RagFlow.exception.WorkflowException;
import com.example.RagFlow.model.ComponentType;
import com.example.RagFlow.model.ModelOutput;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class LlmEngineHandler implements ComponentHandler {

    private static final Logger log = LoggerFactory.getLogger(LlmEngineHandler.class);

    private final EngineProperties properties;

    @Override
    public String type() {
        return ComponentType.LLM_ENGINE.wireName();
    }

    @Override
    public void execute(ExecutionContext context, ComponentConfig config, ExecutionCollaborators collaborators) {
        String modelName = config.getString("modelName", "model_name");
        String customPrompt = config.getString("customPrompt", "custom_prompt");
        double temperature = config.getDouble(properties.getDefaultTemperature(), "temperature");

        String systemPrompt = customPrompt != null ? customPrompt : properties.getDefaultSystemPrompt();
        String userMessage = buildUserMessage(context.getQuery(), context.getRetrievedText());
        List<String> candidates = candidateModels(modelName);

        ModelOutput output;
        try {
            output = context.getDeadline().await("generation",
                    () -> collaborators.languageModel().generate(systemPrompt, userMessage, candidates, temperature));
        } catch (WorkflowException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UpstreamFailureException("Language model call failed: " + ex.getMessage(), ex);
        }
        if (output == null || output.text() == null || output.text().isBlank()) {
            throw new UpstreamFailureException("Language model returned no answer for candidates " + candidates);
        }

        log.debug("Workflow {} answered by {}/{}", context.getWorkflowId(), output.provider(), output.modelUsed());
        context.setModelOutput(output);
    }

    static String buildUserMessage(String query, String retrievedText) {
        if (retrievedText == null || retrievedText.isEmpty()) {
            return query;
        }
        return "Context: " + retrievedText + "\n\nQuestion: " + query;
    }

    /**
     * Configured preference list, then the component's own model as the last resort.
     */
    List<String> candidateModels(String modelName) {
        List<String> candidates = new ArrayList<>(properties.getCandidateModels());
        if (modelName != null) {
            candidates.add(modelName);
        }
        return candidates;
    }
}
