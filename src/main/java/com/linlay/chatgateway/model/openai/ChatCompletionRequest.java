package com.linlay.chatgateway.model.openai;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * OpenAI chat-completions request. Sampling parameters are accepted for compatibility and ignored.
 */
public record ChatCompletionRequest(
        String model,
        @NotEmpty
        List<@Valid Message> messages,
        Boolean stream,
        Double temperature,
        @JsonProperty("top_p")
        Double topP,
        @JsonProperty("presence_penalty")
        Double presencePenalty,
        @JsonProperty("frequency_penalty")
        Double frequencyPenalty,
        List<String> stop,
        Integer n,
        String user,
        Map<String, Object> metadata
) {

    public boolean isStream() {
        return Boolean.TRUE.equals(stream);
    }

    /**
     * @param content either a string or an array of content parts
     */
    public record Message(
            @NotBlank
            String role,
            JsonNode content
    ) {
    }
}
