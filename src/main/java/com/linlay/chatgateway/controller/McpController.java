package com.linlay.chatgateway.controller;

import com.linlay.chatgateway.mcp.McpReply;
import com.linlay.chatgateway.mcp.McpRequestHandler;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/mcp")
public class McpController {

    public static final String SESSION_HEADER = "MCP-Session-Id";

    private final McpRequestHandler requestHandler;

    public McpController(McpRequestHandler requestHandler) {
        this.requestHandler = requestHandler;
    }

    @GetMapping
    public Map<String, Object> discovery() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "code.1c.ai Gateway MCP");
        info.put("version", McpRequestHandler.SERVER_VERSION);
        info.put("endpoint", "/mcp");
        return info;
    }

    @PostMapping(consumes = MediaType.ALL_VALUE)
    public Mono<ResponseEntity<Object>> post(
            @RequestBody(required = false) String body,
            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId
    ) {
        return requestHandler.handle(body, sessionId).map(this::toResponse);
    }

    private ResponseEntity<Object> toResponse(McpReply reply) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(reply.status());
        if (reply.sessionId() != null) {
            builder.header(SESSION_HEADER, reply.sessionId());
        }
        if (reply.body() == null) {
            return builder.build();
        }
        return builder.contentType(MediaType.APPLICATION_JSON).body(reply.body());
    }
}
