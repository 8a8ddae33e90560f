package com.linlay.chatgateway.mcp.tool;

import com.linlay.chatgateway.config.McpProperties;
import com.linlay.chatgateway.mcp.McpToolService;
import com.linlay.chatgateway.mcp.McpToolService.McpToolRequest;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CheckCodeTool extends AbstractUpstreamTool {

    private static final Map<String, String> CHECK_DESCRIPTIONS = Map.of(
            "syntax", "синтаксические ошибки",
            "logic", "логические ошибки и потенциальные проблемы",
            "performance", "проблемы производительности и оптимизации"
    );

    public CheckCodeTool(McpToolService toolService, McpProperties properties) {
        super(toolService, properties);
    }

    @Override
    public String name() {
        return "check_1c_code";
    }

    @Override
    public String description() {
        return "Проверить присланный BSL/1C код на ошибки/проблемы (syntax/logic/performance). "
                + "Использовать, когда есть конкретный фрагмент кода.";
    }

    @Override
    public Map<String, Object> inputSchema() {
        Map<String, Object> checkType = new LinkedHashMap<>();
        checkType.put("type", "string");
        checkType.put("title", "Check type");
        checkType.put("description", "Тип проверки.");
        checkType.put("enum", List.of("syntax", "logic", "performance"));
        checkType.put("default", "syntax");

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("code", stringProperty("Code", "Проверяемый код (желательно компактный фрагмент).",
                properties.getToolInputMinLength()));
        props.put("check_type", checkType);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("title", "Check 1C code");
        schema.put("description", "Проверяет присланный BSL/1C код на ошибки/проблемы.");
        schema.put("properties", props);
        schema.put("required", List.of("code"));
        return schema;
    }

    @Override
    public Mono<String> call(Map<String, Object> args, String sessionId) {
        String code = stringArg(args, "code");
        if (code.isEmpty()) {
            return Mono.just("Ошибка: Код для проверки не может быть пустым");
        }
        String checkType = stringArg(args, "check_type");
        String checkDescription = CHECK_DESCRIPTIONS.getOrDefault(checkType.isEmpty() ? "syntax" : checkType, "ошибки");
        String question = "Проверь этот код 1С на " + checkDescription + " и дай рекомендации:\n\n```1c\n" + code + "\n```";
        McpToolRequest request = new McpToolRequest(name(), sessionId, question, false, null);
        return toolService.ask(request)
                .map(answer -> formatAnswer("Проверка кода на " + checkDescription, answer));
    }
}
