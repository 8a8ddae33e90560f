package com.linlay.chatgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.UpstreamProperties;
import com.linlay.chatgateway.memory.ConversationSessionStore;
import com.linlay.chatgateway.model.api.ChatMessageRequest;
import com.linlay.chatgateway.model.api.ChatSendResponse;
import com.linlay.chatgateway.model.api.FeedbackRequest;
import com.linlay.chatgateway.model.api.FeedbackResponse;
import com.linlay.chatgateway.stream.model.DeltaFragment;
import com.linlay.chatgateway.stream.model.StreamObservation;
import com.linlay.chatgateway.stream.service.DeltaReconciler;
import com.linlay.chatgateway.stream.service.DivergencePolicy;
import com.linlay.chatgateway.text.MessageTruncator;
import com.linlay.chatgateway.text.TextSanitizer;
import com.linlay.chatgateway.text.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 聊天界面 SSE 事件流。
 * <p>
 * 事件顺序：meta → delta/reset → tokens → done。
 * 任意阶段出错都以 error + done 结束，保证前端流总能正常关闭。
 */
@Service
public class ChatStreamService {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamService.class);

    static final String EVENT_META = "meta";
    static final String EVENT_DELTA = "delta";
    static final String EVENT_RESET = "reset";
    static final String EVENT_TOKENS = "tokens";
    static final String EVENT_DONE = "done";
    static final String EVENT_ERROR = "error";

    private final UpstreamChatClient upstreamChatClient;
    private final ConversationSessionStore sessionStore;
    private final UpstreamProperties upstreamProperties;
    private final ObjectMapper objectMapper;

    public ChatStreamService(
            UpstreamChatClient upstreamChatClient,
            ConversationSessionStore sessionStore,
            UpstreamProperties upstreamProperties,
            ObjectMapper objectMapper
    ) {
        this.upstreamChatClient = upstreamChatClient;
        this.sessionStore = sessionStore;
        this.upstreamProperties = upstreamProperties;
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> stream(ChatMessageRequest request) {
        return Flux.defer(() -> {
                    String message = prepareMessage(request.message());
                    int inputTokens = TokenCounter.count(message);
                    return sessionStore.resolveOrCreate(
                                    request.conversationId(),
                                    request.forceNewSession(),
                                    request.programmingLanguage())
                            .flatMapMany(conversationId -> streamConversation(conversationId, message, request.parentUuid(), inputTokens));
                })
                .onErrorResume(ex -> Flux.just(errorEvent(ex), event(EVENT_DONE, Map.of())));
    }

    public Mono<ChatSendResponse> send(ChatMessageRequest request) {
        return Mono.defer(() -> {
            String message = prepareMessage(request.message());
            return sessionStore.resolveOrCreate(
                            request.conversationId(),
                            request.forceNewSession(),
                            request.programmingLanguage())
                    .flatMap(conversationId -> {
                        sessionStore.touch(conversationId);
                        return upstreamChatClient.sendMessageFull(conversationId, message, request.parentUuid())
                                .map(answer -> new ChatSendResponse(conversationId, TextSanitizer.sanitize(answer)));
                    });
        });
    }

    public Mono<FeedbackResponse> feedback(FeedbackRequest request) {
        return upstreamChatClient.sendFeedback(request.messageId(), request.score())
                .doOnError(ex -> log.error("Feedback API error: {}", ex.getMessage()))
                .thenReturn(new FeedbackResponse(true, request.messageId(), request.score()));
    }

    private Flux<ServerSentEvent<String>> streamConversation(
            String conversationId,
            String message,
            String parentUuid,
            int inputTokens
    ) {
        sessionStore.touch(conversationId);
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.EXPLICIT_RESET);
        String[] messageId = new String[1];

        Flux<ServerSentEvent<String>> fragments = upstreamChatClient.streamMessage(conversationId, message, parentUuid)
                .concatMapIterable(observation -> {
                    if (messageId[0] == null && observation.messageId() != null) {
                        messageId[0] = observation.messageId();
                    }
                    return toEvents(conversationId, reconciler, observation, messageId[0]);
                });

        Flux<ServerSentEvent<String>> summary = Flux.defer(() -> {
            int outputTokens = TokenCounter.count(reconciler.previous());
            Map<String, Object> tokens = new LinkedHashMap<>();
            tokens.put("input_tokens", inputTokens);
            tokens.put("output_tokens", outputTokens);
            tokens.put("total_tokens", inputTokens + outputTokens);
            return Flux.just(event(EVENT_TOKENS, tokens), event(EVENT_DONE, Map.of()));
        });

        return Flux.concat(
                Flux.just(event(EVENT_META, Map.of("conversation_id", conversationId))),
                fragments,
                summary
        );
    }

    private List<ServerSentEvent<String>> toEvents(
            String conversationId,
            DeltaReconciler reconciler,
            StreamObservation observation,
            String messageId
    ) {
        List<ServerSentEvent<String>> events = new ArrayList<>();
        for (DeltaFragment fragment : reconciler.accept(observation.text())) {
            if (fragment.reset()) {
                log.debug("[{}] Upstream restarted its answer, sending reset", conversationId);
                events.add(event(EVENT_RESET, Map.of()));
                continue;
            }
            String text = TextSanitizer.sanitize(fragment.text());
            if (text.isEmpty()) {
                continue;
            }
            Map<String, Object> delta = new LinkedHashMap<>();
            delta.put("text", text);
            delta.put("message_id", messageId);
            events.add(event(EVENT_DELTA, delta));
        }
        return events;
    }

    private String prepareMessage(String message) {
        MessageTruncator.Result prepared = MessageTruncator.truncate(message, upstreamProperties.getInputMaxLength());
        if (prepared.truncated()) {
            log.warn("Message truncated from {} to {} characters", message.length(), prepared.text().length());
        }
        return prepared.text();
    }

    private ServerSentEvent<String> errorEvent(Throwable ex) {
        Map<String, Object> error = new LinkedHashMap<>();
        if (ex instanceof UpstreamApiException upstream) {
            log.warn("Chat stream upstream error: {}", upstream.getMessage());
            error.put("message", upstream.getMessage());
            error.put("status_code", upstream.getStatusCode());
        } else {
            log.error("Chat stream failed", ex);
            error.put("message", "Internal server error");
        }
        return event(EVENT_ERROR, error);
    }

    private ServerSentEvent<String> event(String name, Map<String, Object> data) {
        try {
            return ServerSentEvent.<String>builder()
                    .event(name)
                    .data(objectMapper.writeValueAsString(data))
                    .build();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize SSE payload for event " + name, ex);
        }
    }
}
