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
public class AskExpertTool extends AbstractUpstreamTool {

    public AskExpertTool(McpToolService toolService, McpProperties properties) {
        super(toolService, properties);
    }

    @Override
    public String name() {
        return "ask_1c_ai";
    }

    @Override
    public String description() {
        return "Задать вопрос специализированному ИИ-ассистенту по платформе 1С:Предприятие. "
                + "Используйте для общих вопросов и советов. Не используйте для проверки конкретного кода "
                + "или объяснения термина — для этого есть другие инструменты.";
    }

    @Override
    public Map<String, Object> inputSchema() {
        Map<String, Object> language = new LinkedHashMap<>();
        language.put("type", "string");
        language.put("title", "Programming language");
        language.put("description", "Язык программирования (опционально).");
        language.put("enum", List.of("", "BSL", "SQL", "JSON", "HTTP"));
        language.put("default", "");
        language.put("maxLength", properties.getToolInputMaxLength());

        Map<String, Object> createNew = new LinkedHashMap<>();
        createNew.put("type", "boolean");
        createNew.put("title", "Create new conversation");
        createNew.put("description", "Создать новый разговор (сброс контекста).");
        createNew.put("default", false);

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("question", stringProperty("Question", "Чёткая формулировка вопроса/задачи.",
                properties.getToolInputMinLength()));
        props.put("programming_language", language);
        props.put("create_new_session", createNew);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("title", "Ask 1C expert");
        schema.put("description", "Задать экспертный вопрос по платформе 1С:Предприятие. Не для проверки конкретного кода.");
        schema.put("properties", props);
        schema.put("required", List.of("question"));
        schema.put("examples", List.of(
                Map.of("question", "Как правильно использовать HTTPЗапрос для POST с JSON?"),
                Map.of("question", "Как структурировать модуль объекта для тестируемости?", "programming_language", "BSL")
        ));
        return schema;
    }

    @Override
    public Mono<String> call(Map<String, Object> args, String sessionId) {
        String question = stringArg(args, "question");
        if (question.isEmpty()) {
            return Mono.just("Ошибка: Вопрос не может быть пустым");
        }
        String programmingLanguage = stringArg(args, "programming_language");
        McpToolRequest request = new McpToolRequest(
                name(),
                sessionId,
                question,
                booleanArg(args, "create_new_session"),
                programmingLanguage.isEmpty() ? null : programmingLanguage
        );
        return toolService.ask(request).map(answer -> formatAnswer("Ответ от 1С.ai", answer));
    }
}
