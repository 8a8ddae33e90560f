package com.linlay.chatgateway.memory;

import com.linlay.chatgateway.config.SessionProperties;
import com.linlay.chatgateway.service.UpstreamChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 上游会话使用情况缓存。
 * <p>
 * 本地记录只是使用元数据（创建时间、最近使用时间、消息数），会话是否真实有效由上游决定。
 * 容量上限与 TTL 在创建新会话前机会性检查，不依赖后台定时器。
 * 所有读写在同一把锁内完成，插入时按需淘汰最久未使用的一条，保证数量不超过上限。
 */
@Service
public class ConversationSessionStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionStore.class);

    private final UpstreamChatClient upstreamChatClient;
    private final SessionProperties properties;
    private final Clock clock;
    private final Map<String, ConversationSession> sessions = new HashMap<>();

    @Autowired
    public ConversationSessionStore(UpstreamChatClient upstreamChatClient, SessionProperties properties) {
        this(upstreamChatClient, properties, Clock.systemUTC());
    }

    public ConversationSessionStore(UpstreamChatClient upstreamChatClient, SessionProperties properties, Clock clock) {
        this.upstreamChatClient = upstreamChatClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Creates an upstream conversation and registers it. Nothing is registered when the upstream call fails.
     */
    public Mono<String> create(String programmingLanguage) {
        return upstreamChatClient.createConversation(programmingLanguage)
                .doOnNext(this::register);
    }

    public Mono<String> resolveOrCreate(String suppliedConversationId, boolean forceNew, String programmingLanguage) {
        if (forceNew || !StringUtils.hasText(suppliedConversationId)) {
            return Mono.defer(() -> {
                expireStale();
                return create(programmingLanguage);
            });
        }
        String conversationId = suppliedConversationId.trim();
        registerIfAbsent(conversationId);
        return Mono.just(conversationId);
    }

    /**
     * Records one message send: refreshes last-used time and increments the message count.
     */
    public synchronized ConversationSession touch(String conversationId) {
        Instant now = clock.instant();
        ConversationSession existing = sessions.get(conversationId);
        ConversationSession touched = existing == null
                ? insertLocked(ConversationSession.started(conversationId, now)).touched(now)
                : existing.touched(now);
        sessions.put(conversationId, touched);
        return touched;
    }

    public synchronized Optional<ConversationSession> find(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        ConversationSession session = sessions.get(conversationId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(clock.instant(), properties.getTtlSeconds())) {
            sessions.remove(conversationId);
            log.info("Removed expired session: {}", conversationId);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public synchronized int expireStale() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        sessions.forEach((id, session) -> {
            if (session.isExpired(now, properties.getTtlSeconds())) {
                expired.add(id);
            }
        });
        for (String id : expired) {
            sessions.remove(id);
            log.info("Removed expired session: {}", id);
        }
        return expired.size();
    }

    public synchronized int size() {
        return sessions.size();
    }

    synchronized void register(String conversationId) {
        insertLocked(ConversationSession.started(conversationId, clock.instant()));
    }

    private synchronized void registerIfAbsent(String conversationId) {
        if (!sessions.containsKey(conversationId)) {
            insertLocked(ConversationSession.started(conversationId, clock.instant()));
        }
    }

    private ConversationSession insertLocked(ConversationSession session) {
        if (!sessions.containsKey(session.conversationId())) {
            int capacity = Math.max(1, properties.getMaxActiveSessions());
            if (sessions.size() >= capacity) {
                evictLeastRecentlyUsedLocked();
            }
        }
        sessions.put(session.conversationId(), session);
        return session;
    }

    private void evictLeastRecentlyUsedLocked() {
        sessions.values().stream()
                .min(Comparator.comparing(ConversationSession::lastUsedAt))
                .map(ConversationSession::conversationId)
                .ifPresent(oldest -> {
                    sessions.remove(oldest);
                    log.info("Removed oldest session: {}", oldest);
                });
    }
}
