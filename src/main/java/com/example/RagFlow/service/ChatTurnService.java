package com.example.RagFlow.service;

import com.example.RagFlow.exception.ErrorKind;
import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.exception.WorkflowException;
import com.example.RagFlow.model.ChatMessage;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.MessageRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session and message bookkeeping for a turn: one user message, then exactly one assistant
 * message carrying either the answer or the error.
 */
@Service
@RequiredArgsConstructor
public class ChatTurnService {

    private final ChatHistoryStore historyStore;

    /**
     * Resume {@code sessionId}, or open a new session for the workflow when it is null.
     * A session owned by another workflow counts as not found.
     */
    public ChatSession bindSession(Long workflowId, Long sessionId) {
        if (sessionId == null) {
            Long created = historyStore.createSession(workflowId);
            return historyStore.getSession(created)
                    .orElseThrow(() -> ResourceNotFoundException.session(created));
        }
        return historyStore.getSession(sessionId)
                .filter(session -> workflowId.equals(session.getWorkflowId()))
                .orElseThrow(() -> ResourceNotFoundException.session(sessionId));
    }

    public ChatMessage recordUserMessage(Long sessionId, String query) {
        return historyStore.appendMessage(sessionId, MessageRole.USER, query, Map.of());
    }

    public ChatMessage recordAssistantMessage(Long sessionId, String response, Map<String, Object> metadata) {
        return historyStore.appendMessage(sessionId, MessageRole.ASSISTANT, response, metadata);
    }

    public ChatMessage recordAssistantError(Long sessionId, Throwable failure) {
        ErrorKind kind = failure instanceof WorkflowException workflowException
                ? workflowException.getKind()
                : ErrorKind.UPSTREAM_FAILURE;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", true);
        metadata.put("errorKind", kind.name());
        String reason = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return historyStore.appendMessage(sessionId, MessageRole.ASSISTANT, "Error: " + reason, metadata);
    }
}
