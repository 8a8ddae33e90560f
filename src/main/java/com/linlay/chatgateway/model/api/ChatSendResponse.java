package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChatSendResponse(
        @JsonProperty("conversation_id")
        String conversationId,
        String answer
) {
}
