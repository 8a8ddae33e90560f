package com.linlay.chatgateway.model.openai;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    public static final String OBJECT = "chat.completion";

    public static ChatCompletionResponse of(String id, long created, String model, String content) {
        return new ChatCompletionResponse(
                id,
                OBJECT,
                created,
                model,
                List.of(new Choice(0, new AssistantMessage("assistant", content), "stop")),
                new Usage(0, 0, 0)
        );
    }

    public record Choice(
            int index,
            AssistantMessage message,
            @JsonProperty("finish_reason")
            String finishReason
    ) {
    }

    public record AssistantMessage(
            String role,
            String content
    ) {
    }

    public record Usage(
            @JsonProperty("prompt_tokens")
            int promptTokens,
            @JsonProperty("completion_tokens")
            int completionTokens,
            @JsonProperty("total_tokens")
            int totalTokens
    ) {
    }
}
