package com.linlay.chatgateway.mcp.tool;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class McpToolRegistry {

    private final Map<String, McpTool> toolsByName = new LinkedHashMap<>();

    public McpToolRegistry(List<McpTool> tools) {
        tools.stream()
                .sorted((left, right) -> left.name().compareTo(right.name()))
                .forEach(tool -> {
                    if (toolsByName.putIfAbsent(tool.name(), tool) != null) {
                        throw new IllegalStateException("Duplicate MCP tool name: " + tool.name());
                    }
                });
    }

    public List<McpTool> list() {
        return List.copyOf(toolsByName.values());
    }

    public Optional<McpTool> find(String name) {
        return Optional.ofNullable(name).map(toolsByName::get);
    }
}
