package com.linlay.chatgateway.mcp;

import com.linlay.chatgateway.config.McpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * MCP 会话表。所有查询都经过 {@link #get(String)}：过期即删除并返回空，否则刷新最近访问时间。
 * 后台定时清理只用于限制内存，不影响查询语义。
 */
@Service
public class McpSessionStore {

    private static final Logger log = LoggerFactory.getLogger(McpSessionStore.class);

    private final McpProperties properties;
    private final Clock clock;
    private final Map<String, McpSession> sessions = new HashMap<>();

    @Autowired
    public McpSessionStore(McpProperties properties) {
        this(properties, Clock.systemUTC());
    }

    McpSessionStore(McpProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public synchronized McpSession create(String protocolVersion) {
        Instant now = clock.instant();
        String sessionId = UUID.randomUUID().toString().replace("-", "");
        McpSession session = new McpSession(sessionId, protocolVersion == null ? "" : protocolVersion, now, now, null);
        sessions.put(sessionId, session);
        log.debug("Created MCP session {}", sessionId);
        return session;
    }

    public synchronized Optional<McpSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        McpSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (session.isExpired(now, properties.getSessionTtlSeconds())) {
            sessions.remove(sessionId);
            log.debug("MCP session {} expired", sessionId);
            return Optional.empty();
        }
        McpSession seen = session.seen(now);
        sessions.put(sessionId, seen);
        return Optional.of(seen);
    }

    public Optional<String> getConversation(String sessionId) {
        return get(sessionId).map(McpSession::conversationId);
    }

    public synchronized boolean setConversation(String sessionId, String conversationId) {
        Optional<McpSession> session = get(sessionId);
        if (session.isEmpty()) {
            return false;
        }
        sessions.put(sessionId, session.get().withConversation(conversationId));
        return true;
    }

    @Scheduled(fixedDelayString = "${gateway.mcp.sweep-interval-ms:60000}")
    public void sweepExpired() {
        cleanup();
    }

    public synchronized int cleanup() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpired(now, properties.getSessionTtlSeconds()));
        int removed = before - sessions.size();
        if (removed > 0) {
            log.info("Swept {} expired MCP sessions", removed);
        }
        return removed;
    }

    public synchronized int size() {
        return sessions.size();
    }
}
