package com.linlay.chatgateway.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.mcp.tool.McpTool;
import com.linlay.chatgateway.mcp.tool.McpToolRegistry;
import com.linlay.chatgateway.model.mcp.JsonRpcError;
import com.linlay.chatgateway.model.mcp.JsonRpcResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP JSON-RPC 分发器。
 * <p>
 * 传输层错误（非法 JSON、缺少会话头）返回 400 且不带 id；未知或过期会话返回 404；
 * 通知和客户端响应返回 202 空体；其余协议错误以 JSON-RPC error 对象返回，端点本身不会抛出异常。
 */
@Component
public class McpRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(McpRequestHandler.class);

    public static final String SERVER_NAME = "1C.ai Gateway MCP";
    public static final String SERVER_VERSION = "1.0.0";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final McpSessionStore sessionStore;
    private final McpToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public McpRequestHandler(McpSessionStore sessionStore, McpToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.sessionStore = sessionStore;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
    }

    public Mono<McpReply> handle(String body, String sessionHeader) {
        JsonNode payload;
        try {
            payload = StringUtils.hasText(body) ? objectMapper.readTree(body) : null;
        } catch (JsonProcessingException ex) {
            log.debug("Failed to parse MCP body: {}", ex.getOriginalMessage());
            return Mono.just(badRequest("Invalid JSON."));
        }
        if (payload == null || !payload.isObject()) {
            return Mono.just(badRequest("Request body must be a single JSON-RPC object."));
        }

        boolean isRequest = payload.has("method");
        JsonNode id = payload.get("id");
        boolean hasId = id != null && !id.isNull();
        boolean isClientResponse = !isRequest && (payload.has("result") || payload.has("error"));
        String method = isRequest && payload.get("method").isTextual() ? payload.get("method").asText() : null;

        if (isClientResponse || (isRequest && !hasId && !"initialize".equals(method))) {
            return Mono.just(McpReply.accepted());
        }
        if (!isRequest) {
            return Mono.just(badRequest("Unsupported JSON-RPC message type."));
        }
        if (!isValidEnvelope(payload, method)) {
            return Mono.just(badRequest("Invalid JSON-RPC request object."));
        }

        JsonNode requestId = hasId ? id : null;
        JsonNode params = payload.get("params");
        if ("initialize".equals(method)) {
            return Mono.fromSupplier(() -> initialize(requestId, params))
                    .onErrorResume(McpProtocolException.class, ex -> Mono.just(protocolError(requestId, ex)));
        }

        if (!StringUtils.hasText(sessionHeader)) {
            return Mono.just(badRequest("Missing Mcp-Session-Id header."));
        }
        String sessionId = sessionHeader.trim();
        if (sessionStore.get(sessionId).isEmpty()) {
            return Mono.just(McpReply.unknownSession());
        }

        Mono<McpReply> reply = switch (method) {
            case "initialized" -> Mono.error(new McpProtocolException(
                    JsonRpcError.INVALID_REQUEST, "'initialized' must be sent as a notification"));
            case "tools/list" -> Mono.fromSupplier(() -> McpReply.ok(JsonRpcResponse.success(requestId, toolsList())));
            case "tools/call" -> callTool(requestId, params, sessionId);
            default -> Mono.error(new McpProtocolException(JsonRpcError.METHOD_NOT_FOUND, "Method not found: " + method));
        };
        return reply
                .onErrorResume(McpProtocolException.class, ex -> Mono.just(protocolError(requestId, ex)))
                .onErrorResume(ex -> !(ex instanceof McpProtocolException), ex -> {
                    log.error("MCP method {} failed", method, ex);
                    return Mono.just(McpReply.ok(JsonRpcResponse.failure(
                            requestId, JsonRpcError.INTERNAL_ERROR, "Internal error", null)));
                });
    }

    private McpReply initialize(JsonNode requestId, JsonNode params) {
        if (params != null && !params.isNull() && !params.isObject()) {
            throw new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Invalid params for initialize");
        }
        JsonNode clientInfo = params == null ? null : params.get("clientInfo");
        if (clientInfo == null || !clientInfo.isObject() || !clientInfo.path("name").isTextual()) {
            throw new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Invalid params for initialize");
        }
        String protocolVersion = params.path("protocolVersion").asText("");

        McpSession session = sessionStore.create(protocolVersion);
        log.info("MCP session {} initialized by client {}", session.sessionId(), clientInfo.path("name").asText());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", protocolVersion);
        result.put("serverInfo", Map.of("name", SERVER_NAME, "version", SERVER_VERSION));
        result.put("capabilities", Map.of("tools", Map.of()));
        return new McpReply(HttpStatus.OK, JsonRpcResponse.success(requestId, result), session.sessionId());
    }

    private Map<String, Object> toolsList() {
        List<Map<String, Object>> tools = toolRegistry.list().stream()
                .map(tool -> {
                    Map<String, Object> descriptor = new LinkedHashMap<>();
                    descriptor.put("name", tool.name());
                    descriptor.put("description", tool.description());
                    descriptor.put("inputSchema", tool.inputSchema());
                    return descriptor;
                })
                .toList();
        return Map.of("tools", tools);
    }

    private Mono<McpReply> callTool(JsonNode requestId, JsonNode params, String sessionId) {
        if (params == null || !params.isObject() || !params.path("name").isTextual()) {
            return Mono.error(new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Invalid params for tools/call"));
        }
        JsonNode argumentsNode = params.get("arguments");
        if (argumentsNode != null && !argumentsNode.isNull() && !argumentsNode.isObject()) {
            return Mono.error(new McpProtocolException(JsonRpcError.INVALID_PARAMS, "Invalid params for tools/call"));
        }
        String toolName = params.get("name").asText();
        McpTool tool = toolRegistry.find(toolName).orElse(null);
        if (tool == null) {
            return Mono.error(new McpProtocolException(JsonRpcError.METHOD_NOT_FOUND, "Tool not found", Map.of("name", toolName)));
        }
        Map<String, Object> arguments = argumentsNode == null || argumentsNode.isNull()
                ? Map.of()
                : objectMapper.convertValue(argumentsNode, ARGUMENTS_TYPE);

        log.debug("MCP session {} calling tool {}", sessionId, toolName);
        return tool.call(arguments, sessionId)
                .map(text -> Map.of("content", List.of(Map.of("type", "text", "text", text))))
                .map(result -> McpReply.ok(JsonRpcResponse.success(requestId, result)));
    }

    private boolean isValidEnvelope(JsonNode payload, String method) {
        if (method == null) {
            return false;
        }
        JsonNode version = payload.get("jsonrpc");
        if (version != null && !JsonRpcResponse.VERSION.equals(version.asText(null))) {
            return false;
        }
        JsonNode id = payload.get("id");
        if (id != null && !id.isNull() && !id.isTextual() && !id.isIntegralNumber()) {
            return false;
        }
        JsonNode params = payload.get("params");
        return params == null || params.isNull() || params.isObject();
    }

    private McpReply protocolError(JsonNode requestId, McpProtocolException ex) {
        return McpReply.ok(JsonRpcResponse.failure(requestId, ex.getCode(), ex.getMessage(), ex.getData()));
    }

    private McpReply badRequest(String message) {
        return new McpReply(HttpStatus.BAD_REQUEST,
                JsonRpcResponse.failure(null, JsonRpcError.INVALID_REQUEST, message, null), null);
    }
}
