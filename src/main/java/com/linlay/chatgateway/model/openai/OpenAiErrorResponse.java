package com.linlay.chatgateway.model.openai;

public record OpenAiErrorResponse(ErrorBody error) {

    public static OpenAiErrorResponse of(String message, String type, int code) {
        return new OpenAiErrorResponse(new ErrorBody(message, type, code));
    }

    public record ErrorBody(
            String message,
            String type,
            int code
    ) {
    }
}
