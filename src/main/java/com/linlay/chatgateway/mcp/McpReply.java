package com.linlay.chatgateway.mcp;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Transport outcome of one MCP POST: HTTP status, optional JSON body and optional session header value.
 */
public record McpReply(
        HttpStatus status,
        Object body,
        String sessionId
) {

    public static McpReply accepted() {
        return new McpReply(HttpStatus.ACCEPTED, null, null);
    }

    public static McpReply ok(Object body) {
        return new McpReply(HttpStatus.OK, body, null);
    }

    public static McpReply unknownSession() {
        return new McpReply(HttpStatus.NOT_FOUND, Map.of("error", "Unknown or expired session"), null);
    }
}
