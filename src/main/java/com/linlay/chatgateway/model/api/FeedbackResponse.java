package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FeedbackResponse(
        boolean success,
        @JsonProperty("message_id")
        String messageId,
        int score
) {
}
