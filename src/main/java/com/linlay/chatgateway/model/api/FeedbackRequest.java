package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param score 1 for like, -1 for dislike
 */
public record FeedbackRequest(
        @NotBlank
        @JsonProperty("message_id")
        String messageId,
        @NotNull
        Integer score
) {
}
