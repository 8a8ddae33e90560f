package com.linlay.chatgateway.controller;

import com.linlay.chatgateway.model.openai.OpenAiErrorResponse;
import com.linlay.chatgateway.service.UpstreamApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Errors raised before any response bytes are written, rendered in the OpenAI error envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UpstreamApiException.class)
    public ResponseEntity<OpenAiErrorResponse> handleUpstream(UpstreamApiException ex) {
        Integer statusCode = ex.getStatusCode();
        log.warn("API error: {} (status_code={})", ex.getMessage(), statusCode);
        if (statusCode != null && (statusCode == 401 || statusCode == 403)) {
            return error(HttpStatus.UNAUTHORIZED, ex.getMessage(), "authentication_error");
        }
        if (statusCode != null && statusCode == 429) {
            return error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), "rate_limit_exceeded");
        }
        if (statusCode != null && statusCode >= 500) {
            return error(HttpStatus.BAD_GATEWAY, ex.getMessage(), "bad_gateway");
        }
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid_request_error");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<OpenAiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid_request_error");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<OpenAiErrorResponse> handleValidation(WebExchangeBindException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "Validation failed: " + fields, "invalid_request_error");
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<OpenAiErrorResponse> handleInput(ServerWebInputException ex) {
        String reason = ex.getReason();
        return error(HttpStatus.BAD_REQUEST, reason == null || reason.isBlank() ? "Invalid request body" : reason,
                "invalid_request_error");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<OpenAiErrorResponse> handleResponseStatusException(ResponseStatusException ex) {
        int status = ex.getStatusCode().value();
        String message = ex.getReason();
        if (message == null || message.isBlank()) {
            HttpStatus httpStatus = HttpStatus.resolve(status);
            message = httpStatus != null ? httpStatus.getReasonPhrase() : "Request failed";
        }
        return ResponseEntity.status(ex.getStatusCode())
                .body(OpenAiErrorResponse.of(message, "invalid_request_error", status));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OpenAiErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.toString(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "internal_error");
    }

    private String describe(FieldError fieldError) {
        return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }

    private ResponseEntity<OpenAiErrorResponse> error(HttpStatus status, String message, String type) {
        return ResponseEntity.status(status).body(OpenAiErrorResponse.of(message, type, status.value()));
    }
}
