package com.example.RagFlow.service;

import com.example.RagFlow.model.ChatMessage;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.MessageRole;
import com.example.RagFlow.repository.ChatMessageRepository;
import com.example.RagFlow.repository.ChatSessionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Chat history in the relational store. Each call commits on its own, so a user message is
 * durable before the turn that follows it starts.
 */
@Service
@RequiredArgsConstructor
public class JpaChatHistoryStore implements ChatHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JpaChatHistoryStore.class);

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Long createSession(Long workflowId) {
        ChatSession session = new ChatSession();
        session.setWorkflowId(workflowId);
        return sessionRepository.save(session).getId();
    }

    @Override
    public ChatMessage appendMessage(Long sessionId, MessageRole role, String content, Map<String, Object> metadata) {
        ChatMessage message = new ChatMessage();
        message.setSessionId(sessionId);
        message.setRole(role.value());
        message.setContent(content == null ? "" : content);
        message.setMetadataJson(serializeMetadata(metadata));
        ChatMessage saved = messageRepository.save(message);
        log.debug("Appended {} message {} to session {}", saved.getRole(), saved.getId(), sessionId);
        return saved;
    }

    @Override
    public Optional<ChatSession> getSession(Long sessionId) {
        return sessionRepository.findById(sessionId);
    }

    private String serializeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Message metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
