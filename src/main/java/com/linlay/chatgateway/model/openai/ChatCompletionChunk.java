package com.linlay.chatgateway.model.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One {@code chat.completion.chunk}. {@code finish_reason} is always serialized, as {@code null} until the last chunk.
 */
public record ChatCompletionChunk(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices
) {

    public static final String OBJECT = "chat.completion.chunk";

    public static ChatCompletionChunk role(String id, long created, String model) {
        return single(id, created, model, new Delta("assistant", null), null);
    }

    public static ChatCompletionChunk content(String id, long created, String model, String content) {
        return single(id, created, model, new Delta(null, content), null);
    }

    public static ChatCompletionChunk finish(String id, long created, String model) {
        return single(id, created, model, new Delta(null, null), "stop");
    }

    private static ChatCompletionChunk single(String id, long created, String model, Delta delta, String finishReason) {
        return new ChatCompletionChunk(id, OBJECT, created, model, List.of(new Choice(0, delta, finishReason)));
    }

    public record Choice(
            int index,
            Delta delta,
            @JsonProperty("finish_reason")
            @JsonInclude(JsonInclude.Include.ALWAYS)
            String finishReason
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(
            String role,
            String content
    ) {
    }
}
