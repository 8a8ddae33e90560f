package com.linlay.chatgateway.mcp;

import com.linlay.chatgateway.config.UpstreamProperties;
import com.linlay.chatgateway.memory.ConversationSessionStore;
import com.linlay.chatgateway.service.UpstreamChatClient;
import com.linlay.chatgateway.text.MessageTruncator;
import com.linlay.chatgateway.text.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Buffered emitter for MCP tool calls: waits for the complete upstream answer and returns it as plain text.
 * No markup repair is applied.
 */
@Service
public class McpToolService {

    private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

    private final UpstreamChatClient upstreamChatClient;
    private final ConversationSessionStore conversationSessionStore;
    private final McpSessionStore mcpSessionStore;
    private final UpstreamProperties upstreamProperties;

    public McpToolService(
            UpstreamChatClient upstreamChatClient,
            ConversationSessionStore conversationSessionStore,
            McpSessionStore mcpSessionStore,
            UpstreamProperties upstreamProperties
    ) {
        this.upstreamChatClient = upstreamChatClient;
        this.conversationSessionStore = conversationSessionStore;
        this.mcpSessionStore = mcpSessionStore;
        this.upstreamProperties = upstreamProperties;
    }

    public Mono<ToolAnswer> ask(McpToolRequest request) {
        MessageTruncator.Result prepared = MessageTruncator.truncate(request.question(), upstreamProperties.getInputMaxLength());
        if (prepared.truncated()) {
            log.warn("MCP {} question truncated from {} to {} characters",
                    request.toolName(), request.question().length(), prepared.text().length());
        }
        return resolveConversation(request)
                .flatMap(conversationId -> {
                    conversationSessionStore.touch(conversationId);
                    return upstreamChatClient.sendMessageFull(conversationId, prepared.text(), null)
                            .map(answer -> new ToolAnswer(
                                    TextSanitizer.sanitize(answer),
                                    request.sessionId(),
                                    conversationId
                            ));
                });
    }

    private Mono<String> resolveConversation(McpToolRequest request) {
        return Mono.defer(() -> {
            String sessionId = request.sessionId();
            Optional<String> bound = StringUtils.hasText(sessionId)
                    ? mcpSessionStore.getConversation(sessionId).filter(this::isConversationAlive)
                    : Optional.empty();
            if (!request.createNewConversation() && bound.isPresent()) {
                return Mono.just(bound.get());
            }
            return conversationSessionStore.create(request.programmingLanguage())
                    .doOnNext(conversationId -> {
                        if (StringUtils.hasText(sessionId) && !mcpSessionStore.setConversation(sessionId, conversationId)) {
                            log.debug("MCP session {} vanished before binding conversation {}", sessionId, conversationId);
                        }
                    });
        });
    }

    private boolean isConversationAlive(String conversationId) {
        if (conversationSessionStore.find(conversationId).isPresent()) {
            return true;
        }
        log.info("Bound conversation {} expired, starting a new one", conversationId);
        return false;
    }

    public record McpToolRequest(
            String toolName,
            String sessionId,
            String question,
            boolean createNewConversation,
            String programmingLanguage
    ) {
    }

    public record ToolAnswer(
            String text,
            String sessionId,
            String conversationId
    ) {
    }
}
