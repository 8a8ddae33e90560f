package com.linlay.chatgateway.controller;

import com.linlay.chatgateway.config.ChatUiProperties;
import com.linlay.chatgateway.model.api.ChatConfigResponse;
import com.linlay.chatgateway.model.api.ChatErrorResponse;
import com.linlay.chatgateway.model.api.ChatMessageRequest;
import com.linlay.chatgateway.model.api.FeedbackRequest;
import com.linlay.chatgateway.service.ChatStreamService;
import com.linlay.chatgateway.service.UpstreamApiException;
import com.linlay.chatgateway.stream.service.SseFlushWriter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/chat/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatStreamService chatStreamService;
    private final SseFlushWriter sseFlushWriter;
    private final ChatUiProperties chatUiProperties;

    public ChatController(
            ChatStreamService chatStreamService,
            SseFlushWriter sseFlushWriter,
            ChatUiProperties chatUiProperties
    ) {
        this.chatStreamService = chatStreamService;
        this.sseFlushWriter = sseFlushWriter;
        this.chatUiProperties = chatUiProperties;
    }

    @GetMapping("/config")
    public ChatConfigResponse config() {
        return new ChatConfigResponse(chatUiProperties.getMaxAttachedFilesSizeKb());
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> stream(@Valid @RequestBody ChatMessageRequest request, ServerHttpResponse response) {
        return sseFlushWriter.write(response, chatStreamService.stream(request));
    }

    @PostMapping("/send")
    public Mono<ResponseEntity<Object>> send(@Valid @RequestBody ChatMessageRequest request) {
        return chatStreamService.send(request)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(this::toErrorResponse);
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<Object>> feedback(@Valid @RequestBody FeedbackRequest request) {
        return chatStreamService.feedback(request)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(this::toErrorResponse);
    }

    private Mono<ResponseEntity<Object>> toErrorResponse(Throwable ex) {
        if (ex instanceof UpstreamApiException upstream) {
            log.warn("Chat upstream error: {} (status_code={})", upstream.getMessage(), upstream.getStatusCode());
            return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ChatErrorResponse.of(upstream.getMessage(), upstream.getStatusCode())));
        }
        log.error("Unexpected chat error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ChatErrorResponse.of("Internal server error", null)));
    }
}
