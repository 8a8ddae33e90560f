package com.linlay.chatgateway.stream.model;

/**
 * Cumulative text observed so far for one outbound message.
 *
 * @param text      full text produced so far, never {@code null}
 * @param messageId opaque upstream message id, used for feedback correlation
 * @param finished  upstream signalled completion
 */
public record StreamObservation(
        String text,
        String messageId,
        boolean finished
) {

    public StreamObservation {
        if (text == null) {
            text = "";
        }
    }
}
