package com.linlay.chatgateway.stream.model;

/**
 * One decoded upstream SSE event. The upstream mixes two incompatible payload shapes;
 * anything else decodes to {@link Unrecognized} and is skipped by the reader.
 */
public sealed interface UpstreamChunk permits UpstreamChunk.Delta, UpstreamChunk.Cumulative, UpstreamChunk.Unrecognized {

    String ROLE_ASSISTANT = "assistant";
    String ROLE_USER = "user";

    String role();

    String messageId();

    boolean finished();

    default boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role());
    }

    default boolean isUserEcho() {
        return ROLE_USER.equals(role()) && finished();
    }

    /**
     * {@code {"content_delta":{"content":"..."}}}: only the newly produced increment.
     */
    record Delta(String role, String messageId, boolean finished, String content) implements UpstreamChunk {
    }

    /**
     * {@code {"content":{"text":"..."}}}: the full text produced so far.
     */
    record Cumulative(String role, String messageId, boolean finished, String text) implements UpstreamChunk {
    }

    /**
     * Valid envelope without a text payload, still relevant for its finished flag.
     */
    record Unrecognized(String role, String messageId, boolean finished) implements UpstreamChunk {
    }
}
