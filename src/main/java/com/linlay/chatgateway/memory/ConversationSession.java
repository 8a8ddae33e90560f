package com.linlay.chatgateway.memory;

import java.time.Instant;

/**
 * Usage metadata for one upstream conversation. Immutable snapshot; the store replaces it on every touch.
 */
public record ConversationSession(
        String conversationId,
        Instant createdAt,
        Instant lastUsedAt,
        int messageCount
) {

    static ConversationSession started(String conversationId, Instant now) {
        return new ConversationSession(conversationId, now, now, 0);
    }

    ConversationSession touched(Instant now) {
        return new ConversationSession(conversationId, createdAt, now, messageCount + 1);
    }

    boolean isExpired(Instant now, long ttlSeconds) {
        return lastUsedAt.plusSeconds(ttlSeconds).isBefore(now);
    }
}
