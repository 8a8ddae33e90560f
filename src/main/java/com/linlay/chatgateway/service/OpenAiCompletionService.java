package com.linlay.chatgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.OpenAiProperties;
import com.linlay.chatgateway.config.UpstreamProperties;
import com.linlay.chatgateway.memory.ConversationSessionStore;
import com.linlay.chatgateway.model.openai.ChatCompletionChunk;
import com.linlay.chatgateway.model.openai.ChatCompletionRequest;
import com.linlay.chatgateway.model.openai.ChatCompletionResponse;
import com.linlay.chatgateway.stream.model.DeltaFragment;
import com.linlay.chatgateway.stream.model.StreamObservation;
import com.linlay.chatgateway.stream.service.DeltaReconciler;
import com.linlay.chatgateway.stream.service.DivergencePolicy;
import com.linlay.chatgateway.stream.service.SseFlushWriter;
import com.linlay.chatgateway.text.MessageTruncator;
import com.linlay.chatgateway.text.TextSanitizer;
import com.linlay.chatgateway.text.ToolMarkupRepair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * OpenAI 兼容的 chat.completions 实现。
 * <p>
 * 流式模式按 {@link ClientProfile} 选择：标准客户端逐片段输出（最长重叠策略处理分歧）；
 * 需要完整工具标记的客户端（KiloCode）等待上游完成后修复标签，只输出一个内容块。
 * 流中途出错只能以 {@code data: [DONE]} 结束。
 */
@Service
public class OpenAiCompletionService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionService.class);

    public static final String CONVERSATION_HEADER = SseFlushWriter.CONVERSATION_HEADER;
    static final String CREATE_NEW_SESSION_HEADER = "x-1c-create-new-session";
    static final String DONE_MARKER = "[DONE]";
    private static final Set<String> TRUTHY_HEADER_VALUES = Set.of("1", "true", "yes", "y");

    private final UpstreamChatClient upstreamChatClient;
    private final ConversationSessionStore sessionStore;
    private final UpstreamProperties upstreamProperties;
    private final OpenAiProperties openAiProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock = Clock.systemUTC();

    public OpenAiCompletionService(
            UpstreamChatClient upstreamChatClient,
            ConversationSessionStore sessionStore,
            UpstreamProperties upstreamProperties,
            OpenAiProperties openAiProperties,
            ObjectMapper objectMapper
    ) {
        this.upstreamChatClient = upstreamChatClient;
        this.sessionStore = sessionStore;
        this.upstreamProperties = upstreamProperties;
        this.openAiProperties = openAiProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Validates the request and resolves the upstream conversation. Errors here happen before any output is written.
     */
    public Mono<PreparedCompletion> prepare(ChatCompletionRequest request, HttpHeaders headers) {
        return Mono.defer(() -> {
            String instruction = extractInstruction(request.messages());
            if (!StringUtils.hasText(instruction)) {
                return Mono.error(new IllegalArgumentException("messages must include at least one user message"));
            }
            MessageTruncator.Result prepared = MessageTruncator.truncate(instruction, upstreamProperties.getInputMaxLength());
            if (prepared.truncated()) {
                log.warn("OpenAI API message truncated from {} to {} characters",
                        instruction.length(), prepared.text().length());
            }
            ConversationOptions options = extractOptions(request.metadata(), headers);
            String model = StringUtils.hasText(request.model()) ? request.model() : openAiProperties.getPublicModelId();
            ClientProfile profile = ClientProfileClassifier.classify(headers);
            boolean createNew = options.createNewSession() || !StringUtils.hasText(options.conversationId());
            return sessionStore.resolveOrCreate(options.conversationId(), createNew, options.programmingLanguage())
                    .map(conversationId -> new PreparedCompletion(conversationId, prepared.text(), model, profile));
        });
    }

    public Flux<ServerSentEvent<String>> stream(PreparedCompletion completion) {
        return Flux.defer(() -> streamChunks(completion))
                .concatWith(Flux.just(doneEvent()))
                .onErrorResume(ex -> {
                    if (ex instanceof UpstreamApiException) {
                        log.warn("[{}] OpenAI stream aborted by upstream error: {}", completion.conversationId(), ex.getMessage());
                    } else {
                        log.error("[{}] OpenAI stream failed", completion.conversationId(), ex);
                    }
                    return Flux.just(doneEvent());
                });
    }

    private Flux<ServerSentEvent<String>> streamChunks(PreparedCompletion completion) {
        String id = newCompletionId();
        long created = clock.instant().getEpochSecond();
        sessionStore.touch(completion.conversationId());
        Flux<StreamObservation> upstream = upstreamChatClient.streamMessage(
                completion.conversationId(), completion.instruction(), null);

        Flux<ChatCompletionChunk> content = completion.profile() == ClientProfile.BUFFERED_TOOL_MARKUP
                ? bufferedContent(upstream, id, created, completion.model())
                : incrementalContent(upstream, id, created, completion.model());

        return Flux.concat(
                        Flux.just(ChatCompletionChunk.role(id, created, completion.model())),
                        content,
                        Flux.just(ChatCompletionChunk.finish(id, created, completion.model())))
                .map(this::dataEvent);
    }

    public Mono<ChatCompletionResponse> complete(PreparedCompletion completion) {
        return Mono.defer(() -> {
            sessionStore.touch(completion.conversationId());
            return upstreamChatClient.sendMessageFull(completion.conversationId(), completion.instruction(), null);
        }).map(answer -> {
            String text = TextSanitizer.sanitize(answer);
            if (completion.profile() == ClientProfile.BUFFERED_TOOL_MARKUP) {
                text = ToolMarkupRepair.repair(text);
            }
            return ChatCompletionResponse.of(newCompletionId(), clock.instant().getEpochSecond(), completion.model(), text);
        });
    }

    private Flux<ChatCompletionChunk> incrementalContent(
            Flux<StreamObservation> upstream,
            String id,
            long created,
            String model
    ) {
        DeltaReconciler reconciler = new DeltaReconciler(DivergencePolicy.LONGEST_OVERLAP);
        return upstream.concatMapIterable(observation -> {
            List<ChatCompletionChunk> chunks = new ArrayList<>();
            for (DeltaFragment fragment : reconciler.accept(observation.text())) {
                String text = TextSanitizer.sanitize(fragment.text());
                if (!text.isEmpty()) {
                    chunks.add(ChatCompletionChunk.content(id, created, model, text));
                }
            }
            return chunks;
        });
    }

    private Flux<ChatCompletionChunk> bufferedContent(
            Flux<StreamObservation> upstream,
            String id,
            long created,
            String model
    ) {
        return upstream
                .map(StreamObservation::text)
                .filter(StringUtils::hasLength)
                .last("")
                .map(finalText -> ToolMarkupRepair.repair(TextSanitizer.sanitize(finalText)))
                .filter(StringUtils::hasLength)
                .map(text -> ChatCompletionChunk.content(id, created, model, text))
                .flux();
    }

    /**
     * System messages joined by blank lines become a preface to the last user message.
     */
    static String extractInstruction(List<ChatCompletionRequest.Message> messages) {
        if (messages == null) {
            return null;
        }
        List<String> systemParts = new ArrayList<>();
        String lastUser = null;
        for (ChatCompletionRequest.Message message : messages) {
            if (message == null || message.role() == null) {
                continue;
            }
            String role = message.role().toLowerCase(Locale.ROOT);
            if ("system".equals(role)) {
                String text = contentText(message.content());
                if (StringUtils.hasText(text)) {
                    systemParts.add(text);
                }
            } else if ("user".equals(role)) {
                lastUser = contentText(message.content());
            }
        }
        if (lastUser == null) {
            return null;
        }
        String userText = lastUser.strip();
        String preface = String.join("\n\n", systemParts).strip();
        return preface.isEmpty() ? userText : preface + "\n\n" + userText;
    }

    static String contentText(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : content) {
                String part;
                if (item.isTextual()) {
                    part = item.asText();
                } else if (item.isObject()) {
                    part = item.path("text").isTextual() ? item.path("text").asText() : "";
                } else {
                    part = item.toString();
                }
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return String.join("\n", parts);
        }
        return content.toString();
    }

    static ConversationOptions extractOptions(Map<String, Object> metadata, HttpHeaders headers) {
        Map<String, Object> meta = metadata == null ? Map.of() : metadata;
        String conversationId = headers == null ? null : headers.getFirst(CONVERSATION_HEADER);
        if (!StringUtils.hasText(conversationId)) {
            Object fromMeta = meta.get("conversation_id");
            conversationId = fromMeta == null ? null : String.valueOf(fromMeta);
        }

        boolean createNew = isTruthy(meta.get("create_new_session"));
        String headerFlag = headers == null ? null : headers.getFirst(CREATE_NEW_SESSION_HEADER);
        if (StringUtils.hasText(headerFlag)) {
            createNew = createNew || TRUTHY_HEADER_VALUES.contains(headerFlag.trim().toLowerCase(Locale.ROOT));
        }

        Object language = meta.get("programming_language");
        String programmingLanguage = language == null || String.valueOf(language).isEmpty() ? null : String.valueOf(language);
        return new ConversationOptions(conversationId, createNew, programmingLanguage);
    }

    private static boolean isTruthy(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return value instanceof String text && !text.isEmpty();
    }

    private ServerSentEvent<String> dataEvent(ChatCompletionChunk chunk) {
        try {
            return ServerSentEvent.<String>builder().data(objectMapper.writeValueAsString(chunk)).build();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize completion chunk", ex);
        }
    }

    private static ServerSentEvent<String> doneEvent() {
        return ServerSentEvent.<String>builder().data(DONE_MARKER).build();
    }

    private static String newCompletionId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
    }

    public record PreparedCompletion(
            String conversationId,
            String instruction,
            String model,
            ClientProfile profile
    ) {
    }

    record ConversationOptions(
            String conversationId,
            boolean createNewSession,
            String programmingLanguage
    ) {
    }
}
