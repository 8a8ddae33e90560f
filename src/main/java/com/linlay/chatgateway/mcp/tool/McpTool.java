package com.linlay.chatgateway.mcp.tool;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * A tool exposed through MCP {@code tools/list} and {@code tools/call}.
 */
public interface McpTool {

    String name();

    String description();

    Map<String, Object> inputSchema();

    /**
     * @param args      tool arguments, never null
     * @param sessionId MCP session id of the caller, may be null
     * @return text shown to the MCP client
     */
    Mono<String> call(Map<String, Object> args, String sessionId);
}
