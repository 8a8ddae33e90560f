package com.linlay.chatgateway.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body of the chat UI endpoints: {@code {"error":{"message":..,"status_code":..}}}.
 */
public record ChatErrorResponse(ErrorBody error) {

    public static ChatErrorResponse of(String message, Integer statusCode) {
        return new ChatErrorResponse(new ErrorBody(message, statusCode));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorBody(
            String message,
            @JsonProperty("status_code")
            Integer statusCode
    ) {
    }
}
