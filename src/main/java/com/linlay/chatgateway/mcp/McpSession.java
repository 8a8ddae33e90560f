package com.linlay.chatgateway.mcp;

import java.time.Instant;

/**
 * One MCP client session. The session id is generated locally and is never the upstream conversation id.
 */
public record McpSession(
        String sessionId,
        String protocolVersion,
        Instant createdAt,
        Instant lastSeenAt,
        String conversationId
) {

    McpSession seen(Instant now) {
        return new McpSession(sessionId, protocolVersion, createdAt, now, conversationId);
    }

    McpSession withConversation(String newConversationId) {
        return new McpSession(sessionId, protocolVersion, createdAt, lastSeenAt, newConversationId);
    }

    boolean isExpired(Instant now, long ttlSeconds) {
        return lastSeenAt.plusSeconds(ttlSeconds).isBefore(now);
    }
}
