package com.linlay.chatgateway.stream.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Streams gateway SSE frames, one flush per frame.
 * <p>
 * Gateway events only carry {@code event:} and {@code data:} fields. When the client goes away the
 * response cancels the event source, which in turn aborts the upstream call.
 */
@Component
public class SseFlushWriter {

    public static final String CONVERSATION_HEADER = "X-1C-Conversation-Id";

    private static final Logger log = LoggerFactory.getLogger(SseFlushWriter.class);
    private static final MediaType EVENT_STREAM_UTF8 = new MediaType(MediaType.TEXT_EVENT_STREAM, StandardCharsets.UTF_8);

    public Mono<Void> write(ServerHttpResponse response, Flux<ServerSentEvent<String>> events) {
        return write(response, null, events);
    }

    /**
     * @param conversationId upstream conversation echoed in {@value #CONVERSATION_HEADER}, may be {@code null}
     */
    public Mono<Void> write(ServerHttpResponse response, String conversationId, Flux<ServerSentEvent<String>> events) {
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(EVENT_STREAM_UTF8);
        headers.setCacheControl("no-cache, no-transform");
        headers.set("X-Accel-Buffering", "no");
        if (StringUtils.hasText(conversationId)) {
            headers.set(CONVERSATION_HEADER, conversationId);
        }

        return response.writeAndFlushWith(events
                .doOnCancel(() -> log.debug("[{}] SSE client disconnected, upstream stream cancelled", conversationId))
                .map(event -> Mono.just(response.bufferFactory().wrap(frame(event)))));
    }

    static byte[] frame(ServerSentEvent<String> event) {
        StringBuilder frame = new StringBuilder();
        if (StringUtils.hasText(event.event())) {
            frame.append("event: ").append(event.event()).append('\n');
        }
        String data = event.data() == null ? "" : event.data();
        for (String line : data.split("\n", -1)) {
            frame.append("data: ").append(line).append('\n');
        }
        return frame.append('\n').toString().getBytes(StandardCharsets.UTF_8);
    }
}
