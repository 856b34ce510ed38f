package com.example.RagFlow.service;

import java.util.function.Supplier;

/**
 * Admission control for turns on an existing chat session.
 */
public interface SessionTurnGuard {

    /**
     * Run {@code turn} while holding the session. A {@code null} session id means a new session
     * will be created, so nothing is held.
     *
     * @throws com.example.RagFlow.exception.SessionBusyException when another turn holds the session
     */
    <T> T runExclusive(Long sessionId, Supplier<T> turn);
}
