package com.example.RagFlow.service;

import com.example.RagFlow.exception.ResourceNotFoundException;
import com.example.RagFlow.model.ChatMessage;
import com.example.RagFlow.model.ChatMessageResponse;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.ChatSessionRequest;
import com.example.RagFlow.model.ChatSessionResponse;
import com.example.RagFlow.repository.ChatMessageRepository;
import com.example.RagFlow.repository.ChatSessionRepository;
import com.example.RagFlow.repository.WorkflowRepository;
import com.example.RagFlow.util.OffsetPaging;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Read side of chat history plus explicit session management.
 */
@Service
@RequiredArgsConstructor
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() { };

    private final ChatSessionRepository sessionRepository;
    private final ChatMessageRepository messageRepository;
    private final WorkflowRepository workflowRepository;
    private final ObjectMapper objectMapper;

    public ChatSessionResponse create(ChatSessionRequest request) {
        if (request.workflowId() == null || !workflowRepository.existsById(request.workflowId())) {
            throw ResourceNotFoundException.workflow(request.workflowId());
        }
        ChatSession session = new ChatSession();
        session.setWorkflowId(request.workflowId());
        session.setSessionName(request.sessionName());
        return toResponse(sessionRepository.save(session), List.of());
    }

    public ChatSessionResponse get(Long sessionId) {
        ChatSession session = load(sessionId);
        return toResponse(session, listMessages(sessionId, 0, Integer.MAX_VALUE));
    }

    public List<ChatSessionResponse> list(Long workflowId, int skip, int limit) {
        List<ChatSession> sessions = workflowId == null
                ? OffsetPaging.slice(skip, limit, Sort.by("id"), page -> sessionRepository.findAll(page).getContent())
                : OffsetPaging.slice(skip, limit, Sort.unsorted(),
                        page -> sessionRepository.findByWorkflowIdOrderByIdAsc(workflowId, page));
        return sessions.stream()
                .map(session -> toResponse(session, List.of()))
                .toList();
    }

    public List<ChatMessageResponse> listMessages(Long sessionId, int skip, int limit) {
        load(sessionId);
        List<ChatMessage> messages = OffsetPaging.slice(skip, limit, Sort.unsorted(),
                page -> messageRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId, page));
        return messages.stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public void delete(Long sessionId) {
        ChatSession session = load(sessionId);
        messageRepository.deleteBySessionId(sessionId);
        sessionRepository.delete(session);
        log.info("Deleted chat session {}", sessionId);
    }

    private ChatSession load(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.session(sessionId));
    }

    private ChatSessionResponse toResponse(ChatSession session, List<ChatMessageResponse> messages) {
        return new ChatSessionResponse(
                session.getId(),
                session.getWorkflowId(),
                session.getSessionName(),
                session.getCreatedAt(),
                messages
        );
    }

    private ChatMessageResponse toResponse(ChatMessage message) {
        return new ChatMessageResponse(
                message.getId(),
                message.getSessionId(),
                message.getRole(),
                message.getContent(),
                readMetadata(message.getMetadataJson()),
                message.getCreatedAt()
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on chat message: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
