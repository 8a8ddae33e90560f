package com.linlay.chatgateway.stream.adapter.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.stream.model.UpstreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decodes one upstream SSE line (or an already-unwrapped data payload) into an {@link UpstreamChunk}.
 * Returns {@code null} for anything that is not a JSON object data line.
 */
public class UpstreamSseChunkParser {

    private static final Logger log = LoggerFactory.getLogger(UpstreamSseChunkParser.class);
    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper objectMapper;

    public UpstreamSseChunkParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public UpstreamChunk parseOrNull(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception ex) {
            log.debug("Skipping unparseable upstream SSE chunk: {}", rawChunk);
            return null;
        }
        if (root == null || !root.isObject()) {
            log.warn("Skipping upstream SSE chunk that is not an object: {}", rawChunk);
            return null;
        }

        String role = optionalText(root.get("role"));
        String messageId = optionalText(root.get("uuid"));
        boolean finished = root.path("finished").asBoolean(false);

        JsonNode deltaNode = root.get("content_delta");
        boolean hasDelta = deltaNode != null && deltaNode.isObject();
        String deltaContent = hasDelta ? optionalText(deltaNode.get("content")) : null;
        if (hasText(deltaContent)) {
            return new UpstreamChunk.Delta(role, messageId, finished, deltaContent);
        }

        JsonNode contentNode = root.get("content");
        if (contentNode != null && contentNode.isObject() && contentNode.has("text")) {
            String text = optionalText(contentNode.get("text"));
            return new UpstreamChunk.Cumulative(role, messageId, finished, text == null ? "" : text);
        }

        if (hasDelta) {
            return new UpstreamChunk.Delta(role, messageId, finished, "");
        }
        return new UpstreamChunk.Unrecognized(role, messageId, finished);
    }

    private String normalizePayload(String rawChunk) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith(DATA_PREFIX)) {
            payload = payload.substring(DATA_PREFIX.length()).trim();
        } else if (!payload.startsWith("{")) {
            return null;
        }
        if (payload.isEmpty() || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private boolean hasText(String text) {
        return text != null && !text.isEmpty();
    }
}
