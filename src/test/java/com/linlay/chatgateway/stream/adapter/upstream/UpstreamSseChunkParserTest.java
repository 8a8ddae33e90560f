package com.linlay.chatgateway.stream.adapter.upstream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.stream.model.UpstreamChunk;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamSseChunkParserTest {

    private final UpstreamSseChunkParser parser = new UpstreamSseChunkParser(new ObjectMapper());

    @Test
    void shouldDecodeDeltaChunk() {
        UpstreamChunk chunk = parser.parseOrNull(
                "data: {\"role\":\"assistant\",\"uuid\":\"m-1\",\"finished\":false,\"content_delta\":{\"content\":\"Hel\"}}");

        assertThat(chunk).isEqualTo(new UpstreamChunk.Delta("assistant", "m-1", false, "Hel"));
    }

    @Test
    void shouldDecodeCumulativeChunkFromUnwrappedPayload() {
        UpstreamChunk chunk = parser.parseOrNull(
                "{\"role\":\"assistant\",\"uuid\":\"m-2\",\"finished\":true,\"content\":{\"text\":\"Hello!\"}}");

        assertThat(chunk).isEqualTo(new UpstreamChunk.Cumulative("assistant", "m-2", true, "Hello!"));
    }

    @Test
    void emptyDeltaShouldStillCarryFinishedFlag() {
        UpstreamChunk chunk = parser.parseOrNull(
                "data:{\"role\":\"assistant\",\"finished\":true,\"content_delta\":{\"content\":\"\"}}");

        assertThat(chunk).isInstanceOf(UpstreamChunk.Delta.class);
        assertThat(chunk.finished()).isTrue();
    }

    @Test
    void envelopeWithoutTextShouldBeUnrecognized() {
        UpstreamChunk chunk = parser.parseOrNull("data: {\"role\":\"assistant\",\"uuid\":\"m-3\",\"finished\":true}");

        assertThat(chunk).isEqualTo(new UpstreamChunk.Unrecognized("assistant", "m-3", true));
    }

    @Test
    void nonDataLinesAndGarbageShouldBeSkipped() {
        assertThat(parser.parseOrNull("event: message")).isNull();
        assertThat(parser.parseOrNull(": keep-alive")).isNull();
        assertThat(parser.parseOrNull("data: [DONE]")).isNull();
        assertThat(parser.parseOrNull("data: {not json")).isNull();
        assertThat(parser.parseOrNull("data: [1,2]")).isNull();
        assertThat(parser.parseOrNull("")).isNull();
        assertThat(parser.parseOrNull(null)).isNull();
    }
}
