package com.example.RagFlow.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * No admission control: concurrent turns on one session interleave their messages.
 */
@Component
@ConditionalOnProperty(prefix = "ragflow.engine.session-lock", name = "enabled", havingValue = "false", matchIfMissing = true)
public class DirectSessionTurnGuard implements SessionTurnGuard {

    @Override
    public <T> T runExclusive(Long sessionId, Supplier<T> turn) {
        return turn.get();
    }
}
