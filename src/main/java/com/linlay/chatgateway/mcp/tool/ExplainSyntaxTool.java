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
public class ExplainSyntaxTool extends AbstractUpstreamTool {

    public ExplainSyntaxTool(McpToolService toolService, McpProperties properties) {
        super(toolService, properties);
    }

    @Override
    public String name() {
        return "explain_1c_syntax";
    }

    @Override
    public String description() {
        return "Объяснить конкретный элемент синтаксиса/объект платформы 1С (например, HTTPСоединение, "
                + "HTTPЗапрос, ТаблицаЗначений, Запрос) с примерами. Не использовать для аудита кода.";
    }

    @Override
    public Map<String, Object> inputSchema() {
        Map<String, Object> context = stringProperty("Context", "Доп. контекст: где/как используется (опционально).", 0);
        context.put("default", "");

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("syntax_element", stringProperty("Syntax element",
                "Название элемента (например, HTTPЗапрос, ТаблицаЗначений).", properties.getToolInputMinLength()));
        props.put("context", context);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("title", "Explain 1C syntax");
        schema.put("description", "Поясняет конкретный элемент синтаксиса/объект платформы 1С с примерами.");
        schema.put("properties", props);
        schema.put("required", List.of("syntax_element"));
        schema.put("examples", List.of(
                Map.of("syntax_element", "HTTPСоединение", "context", "аутентификация и повторные попытки"),
                Map.of("syntax_element", "Запрос")
        ));
        return schema;
    }

    @Override
    public Mono<String> call(Map<String, Object> args, String sessionId) {
        String syntaxElement = stringArg(args, "syntax_element");
        if (syntaxElement.isEmpty()) {
            return Mono.just("Ошибка: Элемент синтаксиса не может быть пустым");
        }
        String context = stringArg(args, "context");
        String question = "Объясни синтаксис и использование: " + syntaxElement;
        if (!context.isEmpty()) {
            question += " в контексте: " + context;
        }
        McpToolRequest request = new McpToolRequest(name(), sessionId, question, false, null);
        return toolService.ask(request)
                .map(answer -> formatAnswer("Объяснение синтаксиса '" + syntaxElement + "'", answer));
    }
}
