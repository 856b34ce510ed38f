package com.example.RagFlow.engine;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.exception.WorkflowValidationException;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.TurnOutput;
import com.example.RagFlow.model.TurnState;
import com.example.RagFlow.model.ValidationResult;
import com.example.RagFlow.model.WorkflowComponent;
import com.example.RagFlow.model.WorkflowDefinition;
import com.example.RagFlow.model.WorkflowExecuteResponse;
import com.example.RagFlow.service.ChatTurnService;
import com.example.RagFlow.service.WorkflowDefinitionStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs one chat turn against a stored workflow:
 * validate → order → bind session → persist user message → dispatch → persist assistant message.
 * <p>
 * Nothing is written before the session is bound, so rejected turns leave no trace. Once the user
 * message is stored, every outcome also stores an assistant message; failures are recorded with
 * {@code {error: true}} and then rethrown unchanged.
 * <p>
 * Turns on the same session are not serialized here; see {@link com.example.RagFlow.service.SessionTurnGuard}.
 */
@Service
@RequiredArgsConstructor
public class WorkflowExecutionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionService.class);

    private final WorkflowDefinitionStore definitionStore;
    private final GraphValidator validator;
    private final ExecutionOrderResolver orderResolver;
    private final ComponentHandlerRegistry handlerRegistry;
    private final ChatTurnService turnService;
    private final ExecutionCollaborators collaborators;
    private final EngineProperties properties;

    public WorkflowExecuteResponse execute(Long workflowId, String query, Long sessionId) {
        long started = System.nanoTime();
        TurnState state = TurnState.PENDING;

        if (query == null || query.isBlank()) {
            throw new WorkflowValidationException(List.of("Query must not be blank"));
        }
        WorkflowDefinition definition = definitionStore.get(workflowId)
                .orElseThrow(() -> ResourceNotFoundException.workflow(workflowId));

        state = transition(workflowId, state, TurnState.VALIDATING);
        List<String> order;
        try {
            ValidationResult validation = validator.validate(definition.components(), definition.connections());
            if (!validation.isValid()) {
                throw new WorkflowValidationException(validation.errors());
            }
            order = orderResolver.resolve(definition.components(), definition.connections());
        } catch (RuntimeException ex) {
            transition(workflowId, state, TurnState.REJECTED);
            throw ex;
        }

        state = transition(workflowId, state, TurnState.SESSION_BINDING);
        ChatSession session = turnService.bindSession(workflowId, sessionId);
        turnService.recordUserMessage(session.getId(), query);
        state = transition(workflowId, state, TurnState.USER_MESSAGE_PERSISTED);

        state = transition(workflowId, state, TurnState.EXECUTING);
        ExecutionContext context = new ExecutionContext(workflowId, query, TurnDeadline.after(properties.getTurnTimeout()));
        try {
            TurnOutput output = dispatch(definition, order, context);
            turnService.recordAssistantMessage(session.getId(), output.response(), output.metadata());
            transition(workflowId, state, TurnState.COMPLETED);

            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            log.info("Workflow {} answered turn in session {} in {} ms", workflowId, session.getId(), elapsedMs);
            return new WorkflowExecuteResponse(output.response(), session.getId(), elapsedMs, output.metadata());
        } catch (RuntimeException ex) {
            transition(workflowId, state, TurnState.FAILED);
            log.warn("Workflow {} failed in session {}: {}", workflowId, session.getId(), ex.getMessage());
            try {
                turnService.recordAssistantError(session.getId(), ex);
            } catch (RuntimeException persistFailure) {
                log.error("Could not record failure for session {}", session.getId(), persistFailure);
                ex.addSuppressed(persistFailure);
            }
            throw ex;
        }
    }

    private TurnOutput dispatch(WorkflowDefinition definition, List<String> order, ExecutionContext context) {
        Map<String, WorkflowComponent> componentsById = definition.components().stream()
                .collect(Collectors.toMap(WorkflowComponent::id, Function.identity()));

        for (String componentId : order) {
            if (context.isCompleted()) {
                log.debug("Output produced; skipping component {}", componentId);
                continue;
            }
            WorkflowComponent component = componentsById.get(componentId);
            Optional<ComponentHandler> handler = handlerRegistry.find(component.type());
            if (handler.isEmpty()) {
                log.warn("No handler for component {} of type '{}'; skipping", componentId, component.type());
                continue;
            }
            context.getDeadline().ensureNotExpired("component " + componentId);
            log.debug("Dispatching component {} ({})", componentId, component.type());
            handler.get().execute(context, new ComponentConfig(component.data()), collaborators);
        }

        return context.isCompleted()
                ? context.getOutput()
                : new TurnOutput(properties.getFallbackResponse(), Map.of());
    }

    private TurnState transition(Long workflowId, TurnState from, TurnState to) {
        log.debug("Workflow {} turn {} -> {}", workflowId, from, to);
        return to;
    }
}
