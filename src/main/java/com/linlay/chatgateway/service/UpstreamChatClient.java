package com.linlay.chatgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.UpstreamLogProperties;
import com.linlay.chatgateway.config.UpstreamProperties;
import com.linlay.chatgateway.stream.adapter.upstream.UpstreamSseChunkParser;
import com.linlay.chatgateway.stream.model.StreamObservation;
import com.linlay.chatgateway.stream.model.UpstreamChunk;
import com.linlay.chatgateway.stream.service.UpstreamStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 上游对话服务客户端：创建会话、发送消息（SSE 流）、提交反馈。
 * <p>
 * 每次 {@link #streamMessage} 调用对应一次上游流式请求；下游取消订阅时底层连接随之取消。
 * 不做重试，失败统一转换为 {@link UpstreamApiException}。
 */
@Service
public class UpstreamChatClient {

    private static final Logger log = LoggerFactory.getLogger(UpstreamChatClient.class);
    private static final String CONVERSATIONS_PATH = "/chat_api/v1/conversations/";
    private static final String MESSAGES_PATH = "/chat_api/v1/conversations/{conversationId}/messages";
    private static final String FEEDBACK_PATH = "/chat_api/v1/feedbacks/{messageId}/like";
    private static final MediaType JSON_UTF8 = MediaType.parseMediaType("application/json; charset=utf-8");

    private final UpstreamProperties properties;
    private final UpstreamLogProperties logProperties;
    private final ObjectMapper objectMapper;
    private final UpstreamSseChunkParser chunkParser;
    private final WebClient webClient;

    public UpstreamChatClient(
            WebClient.Builder webClientBuilder,
            UpstreamProperties properties,
            UpstreamLogProperties logProperties,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.logProperties = logProperties;
        this.objectMapper = objectMapper;
        this.chunkParser = new UpstreamSseChunkParser(objectMapper);
        this.webClient = buildWebClient(webClientBuilder.clone(), properties);
    }

    public Mono<String> createConversation(String programmingLanguage) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("is_chat", true);
        request.put("skill_name", "custom");
        request.put("ui_language", properties.getUiLanguage());
        request.put("programming_language", StringUtils.hasText(programmingLanguage)
                ? programmingLanguage.trim()
                : properties.getProgrammingLanguage());

        return Mono.defer(() -> {
                    log.info("Creating new upstream conversation");
                    return webClient.post()
                            .uri(CONVERSATIONS_PATH)
                            .header("Session-Id", "")
                            .bodyValue(request)
                            .retrieve()
                            .onStatus(status -> !status.is2xxSuccessful(),
                                    response -> statusError("Conversation create error", response))
                            .bodyToMono(String.class);
                })
                .map(this::readConversationId)
                .doOnNext(conversationId -> log.info("Created new conversation: {}", conversationId))
                .onErrorMap(ex -> !(ex instanceof UpstreamApiException),
                        ex -> new UpstreamApiException("Network error creating conversation: " + ex.getMessage(), ex));
    }

    /**
     * Sends one message and streams cumulative observations until the upstream marks the
     * assistant answer finished; consumption stops right after the finished observation.
     */
    public Flux<StreamObservation> streamMessage(String conversationId, String message, String parentUuid) {
        return Flux.defer(() -> {
            UpstreamStreamReader reader = new UpstreamStreamReader();
            log.info("[{}] Sending message to upstream, length={}", conversationId, message == null ? 0 : message.length());
            log.debug("[{}] parent_uuid from request: {}", conversationId, parentUuid);
            Map<String, Object> request = buildMessageRequest(message, parentUuid);
            logRequestBody(conversationId, request);

            return webClient.post()
                    .uri(MESSAGES_PATH, conversationId)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(),
                            response -> statusError("Message send error", response))
                    .bodyToFlux(String.class)
                    .<StreamObservation>handle((rawChunk, sink) -> {
                        UpstreamChunk chunk = chunkParser.parseOrNull(rawChunk);
                        StreamObservation observation = reader.accept(chunk);
                        if (observation != null) {
                            sink.next(observation);
                        }
                    })
                    .takeUntil(StreamObservation::finished)
                    .doOnComplete(() -> log.debug("[{}] Upstream stream finished, totalLength={}",
                            conversationId, reader.lastText().length()))
                    .doOnCancel(() -> log.debug("[{}] Upstream stream cancelled, partialLength={}",
                            conversationId, reader.lastText().length()));
        }).onErrorMap(ex -> !(ex instanceof UpstreamApiException),
                ex -> new UpstreamApiException("Network error sending message: " + ex.getMessage(), ex));
    }

    public Mono<String> sendMessageFull(String conversationId, String message, String parentUuid) {
        return streamMessage(conversationId, message, parentUuid)
                .map(StreamObservation::text)
                .filter(StringUtils::hasLength)
                .last("")
                .map(String::strip);
    }

    public Mono<Void> sendFeedback(String messageId, int score) {
        return Mono.defer(() -> {
                    log.info("Sending feedback: message_id={}, score={}", messageId, score);
                    return webClient.post()
                            .uri(FEEDBACK_PATH, messageId)
                            .bodyValue(Map.of("score", score))
                            .exchangeToMono(response -> {
                                int status = response.statusCode().value();
                                if (status == 200 || status == 204) {
                                    return response.releaseBody();
                                }
                                return response.releaseBody()
                                        .then(Mono.<Void>error(new UpstreamApiException("Feedback error: " + status, status)));
                            });
                })
                .doOnSuccess(ignored -> log.info("Feedback sent successfully: message_id={}, score={}", messageId, score))
                .onErrorMap(ex -> !(ex instanceof UpstreamApiException),
                        ex -> new UpstreamApiException("Network error sending feedback: " + ex.getMessage(), ex));
    }

    private Map<String, Object> buildMessageRequest(String message, String parentUuid) {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("instruction", message == null ? "" : message);
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("content", inner);
        outer.put("tools", null);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("content", outer);
        request.put("parent_uuid", StringUtils.hasText(parentUuid) ? parentUuid.trim() : null);
        request.put("role", "user");
        return request;
    }

    private void logRequestBody(String conversationId, Map<String, Object> request) {
        if (!logProperties.isEnabled() || !log.isDebugEnabled()) {
            return;
        }
        try {
            String body = objectMapper.writeValueAsString(request);
            log.debug("[{}] upstream request body: {}", conversationId,
                    LogSanitizer.truncate(body, logProperties.getRequestBodyMaxLength()));
        } catch (JsonProcessingException ex) {
            log.debug("[{}] upstream request body not serializable: {}", conversationId, ex.getOriginalMessage());
        }
    }

    private String readConversationId(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            String uuid = root == null ? null : root.path("uuid").asText(null);
            if (!StringUtils.hasText(uuid)) {
                throw new UpstreamApiException("Conversation create error: response has no uuid", (Integer) null);
            }
            return uuid;
        } catch (UpstreamApiException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new UpstreamApiException("Unexpected error creating conversation: " + ex.getMessage(), ex);
        }
    }

    private Mono<? extends Throwable> statusError(String prefix, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.releaseBody()
                .then(Mono.<Throwable>error(new UpstreamApiException(prefix + ": " + status.value(), status.value())));
    }

    private static WebClient buildWebClient(WebClient.Builder builder, UpstreamProperties properties) {
        String baseUrl = properties.getBaseUrl() == null ? "" : properties.getBaseUrl().replaceAll("/+$", "");
        builder.baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, "*/*")
                .defaultHeader(HttpHeaders.ACCEPT_CHARSET, "utf-8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "ru-ru,en-us;q=0.8,en;q=0.7")
                .defaultHeader(HttpHeaders.CONTENT_TYPE, JSON_UTF8.toString())
                .defaultHeader(HttpHeaders.ORIGIN, baseUrl)
                .defaultHeader(HttpHeaders.REFERER, baseUrl + "/chat/");
        if (StringUtils.hasText(properties.getToken())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, properties.getToken());
        }
        return builder.build();
    }
}
