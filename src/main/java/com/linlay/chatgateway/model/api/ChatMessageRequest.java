package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record ChatMessageRequest(
        @NotNull
        String message,
        @JsonProperty("conversation_id")
        String conversationId,
        @JsonProperty("create_new_session")
        Boolean createNewSession,
        @JsonProperty("programming_language")
        String programmingLanguage,
        @JsonProperty("parent_uuid")
        String parentUuid
) {

    public boolean forceNewSession() {
        return Boolean.TRUE.equals(createNewSession);
    }
}
