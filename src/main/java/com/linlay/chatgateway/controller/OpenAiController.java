package com.linlay.chatgateway.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.OpenAiProperties;
import com.linlay.chatgateway.model.openai.ChatCompletionRequest;
import com.linlay.chatgateway.model.openai.ModelListResponse;
import com.linlay.chatgateway.service.OpenAiCompletionService;
import com.linlay.chatgateway.service.OpenAiCompletionService.PreparedCompletion;
import com.linlay.chatgateway.stream.service.SseFlushWriter;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private final OpenAiCompletionService completionService;
    private final OpenAiProperties openAiProperties;
    private final SseFlushWriter sseFlushWriter;
    private final ObjectMapper objectMapper;

    public OpenAiController(
            OpenAiCompletionService completionService,
            OpenAiProperties openAiProperties,
            SseFlushWriter sseFlushWriter,
            ObjectMapper objectMapper
    ) {
        this.completionService = completionService;
        this.openAiProperties = openAiProperties;
        this.sseFlushWriter = sseFlushWriter;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/models")
    public ModelListResponse models() {
        return ModelListResponse.of(List.of(new ModelListResponse.ModelData(
                openAiProperties.getPublicModelId(),
                "model",
                Instant.now().getEpochSecond(),
                "onec-ai"
        )));
    }

    @PostMapping("/chat/completions")
    public Mono<Void> chatCompletions(
            @Valid @RequestBody ChatCompletionRequest request,
            ServerHttpRequest httpRequest,
            ServerHttpResponse response
    ) {
        return completionService.prepare(request, httpRequest.getHeaders())
                .flatMap(completion -> {
                    if (request.isStream()) {
                        return sseFlushWriter.write(response, completion.conversationId(), completionService.stream(completion));
                    }
                    response.getHeaders().set(SseFlushWriter.CONVERSATION_HEADER, completion.conversationId());
                    return completionService.complete(completion)
                            .flatMap(body -> writeJson(response, body));
                });
    }

    private Mono<Void> writeJson(ServerHttpResponse response, Object body) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            return Mono.error(ex);
        }
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }
}
