package com.example.RagFlow.service;

import com.example.RagFlow.config.EngineProperties;
import com.example.RagFlow.exception.SessionBusyException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * One turn per session at a time, across instances. A second turn arriving while the lease is
 * held is rejected rather than queued.
 */
@Component
@ConditionalOnProperty(prefix = "ragflow.engine.session-lock", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class RedisSessionTurnGuard implements SessionTurnGuard {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionTurnGuard.class);

    static final String KEY_PREFIX = "ragflow:session:turn:";

    // Delete only if we still own the lease.
    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final EngineProperties properties;

    @Override
    public <T> T runExclusive(Long sessionId, Supplier<T> turn) {
        if (sessionId == null) {
            return turn.get();
        }

        String key = KEY_PREFIX + sessionId;
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key, token, properties.getSessionLock().getTtl());
        if (!Boolean.TRUE.equals(acquired)) {
            throw new SessionBusyException(sessionId);
        }

        try {
            return turn.get();
        } finally {
            release(key, token);
        }
    }

    private void release(String key, String token) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(key), token);
        } catch (RuntimeException ex) {
            // The lease expires on its own.
            log.warn("Failed to release turn lock {}: {}", key, ex.getMessage());
        }
    }
}
