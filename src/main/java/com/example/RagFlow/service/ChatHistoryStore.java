package com.example.RagFlow.service;

import com.example.RagFlow.model.ChatMessage;
import com.example.RagFlow.model.ChatSession;
import com.example.RagFlow.model.MessageRole;

import java.util.Map;
import java.util.Optional;

public interface ChatHistoryStore {

    Long createSession(Long workflowId);

    ChatMessage appendMessage(Long sessionId, MessageRole role, String content, Map<String, Object> metadata);

    Optional<ChatSession> getSession(Long sessionId);
}
