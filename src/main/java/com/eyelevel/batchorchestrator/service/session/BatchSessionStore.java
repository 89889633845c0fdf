package com.eyelevel.batchorchestrator.service.session;

import com.eyelevel.batchorchestrator.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of {@link BatchSession}s keyed by the client's session id. Sessions are
 * created on first use and evicted by {@link StaleSessionCleanupScheduler} once idle.
 */
@Slf4j
@Component
public class BatchSessionStore {

    private static final int MAX_SESSION_ID_LENGTH = 128;

    private final Map<String, BatchSession> sessions = new ConcurrentHashMap<>();

    public BatchSession getOrCreate(String sessionId) {
        String key = validate(sessionId);
        BatchSession session = sessions.computeIfAbsent(key, id -> {
            log.info("Creating batch session '{}'", id);
            return new BatchSession(id);
        });
        session.touch();
        return session;
    }

    /**
     * @throws SessionNotFoundException if the session does not exist.
     */
    public BatchSession get(String sessionId) {
        BatchSession session = sessions.get(validate(sessionId));
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.touch();
        return session;
    }

    /**
     * Removes sessions idle since before {@code threshold} that have no batch running.
     *
     * @return the number of sessions removed.
     */
    public int evictIdle(Instant threshold) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isIdleSince(threshold) && !session.hasRunningBatch());
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }

    private static String validate(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("A session id is required");
        }
        String trimmed = sessionId.trim();
        if (trimmed.length() > MAX_SESSION_ID_LENGTH) {
            throw new IllegalArgumentException("Session id must be at most " + MAX_SESSION_ID_LENGTH + " characters");
        }
        return trimmed;
    }
}
