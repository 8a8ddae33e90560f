package com.linlay.chatgateway.stream.service;

import com.linlay.chatgateway.stream.model.StreamObservation;
import com.linlay.chatgateway.stream.model.UpstreamChunk;
import com.linlay.chatgateway.text.TextSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 单条上游消息流的状态机：把 delta 与累计两种分片格式统一为累计文本观测。
 * <p>
 * 每次上游调用创建一个实例，非线程安全；调用方按到达顺序逐个喂入分片。
 */
public class UpstreamStreamReader {

    private static final Logger log = LoggerFactory.getLogger(UpstreamStreamReader.class);

    private final StringBuilder accumulated = new StringBuilder();
    private String previousCumulative = "";
    private String lastText = "";
    private boolean completed;

    /**
     * @return the observation produced by this chunk, or {@code null} when it carries nothing new
     */
    public StreamObservation accept(UpstreamChunk chunk) {
        if (chunk == null || completed) {
            return null;
        }
        if (chunk.isUserEcho()) {
            log.debug("Received user message echo, waiting for assistant response");
            return null;
        }
        boolean contentBearing = chunk instanceof UpstreamChunk.Delta || chunk.isAssistant();
        if (!contentBearing) {
            return null;
        }

        String text = null;
        if (chunk instanceof UpstreamChunk.Delta delta && !delta.content().isEmpty()) {
            accumulated.append(delta.content());
            text = accumulated.toString();
        } else if (chunk instanceof UpstreamChunk.Cumulative cumulative && !cumulative.text().isEmpty()) {
            if (!cumulative.text().equals(previousCumulative)) {
                previousCumulative = cumulative.text();
                text = cumulative.text();
            }
        }

        if (chunk.finished()) {
            completed = true;
        }
        if (text != null) {
            lastText = TextSanitizer.stripInvalidSequences(text);
            log.trace("[upstream] format={}, totalLength={}",
                    chunk instanceof UpstreamChunk.Delta ? "delta" : "cumulative", lastText.length());
            return new StreamObservation(lastText, chunk.messageId(), chunk.finished());
        }
        if (chunk.finished()) {
            return new StreamObservation(lastText, chunk.messageId(), true);
        }
        return null;
    }

    public boolean isCompleted() {
        return completed;
    }

    public String lastText() {
        return lastText;
    }
}
