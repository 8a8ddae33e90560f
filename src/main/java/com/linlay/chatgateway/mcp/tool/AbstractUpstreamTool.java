package com.linlay.chatgateway.mcp.tool;

import com.linlay.chatgateway.config.McpProperties;
import com.linlay.chatgateway.mcp.McpToolService;
import com.linlay.chatgateway.mcp.McpToolService.ToolAnswer;

import java.util.LinkedHashMap;
import java.util.Map;

abstract class AbstractUpstreamTool implements McpTool {

    protected final McpToolService toolService;
    protected final McpProperties properties;

    protected AbstractUpstreamTool(McpToolService toolService, McpProperties properties) {
        this.toolService = toolService;
        this.properties = properties;
    }

    protected static String stringArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? "" : String.valueOf(value).trim();
    }

    protected static boolean booleanArg(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value).trim());
    }

    protected Map<String, Object> stringProperty(String title, String description, int minLength) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "string");
        property.put("title", title);
        property.put("description", description);
        property.put("minLength", minLength);
        property.put("maxLength", properties.getToolInputMaxLength());
        return property;
    }

    protected static String formatAnswer(String heading, ToolAnswer answer) {
        String session = answer.sessionId() == null || answer.sessionId().isBlank() ? "-" : answer.sessionId();
        return heading + ":\n\n" + answer.text() + "\n\nСессия: " + session + "\nРазговор: " + answer.conversationId();
    }
}
