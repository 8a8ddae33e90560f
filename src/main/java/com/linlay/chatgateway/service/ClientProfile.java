package com.linlay.chatgateway.service;

/**
 * How the OpenAI-compatible emitter streams to a given client.
 */
public enum ClientProfile {

    /** One chunk per reconciled fragment. */
    STANDARD,

    /** Whole answer in one chunk after completion, with tool markup repaired. */
    BUFFERED_TOOL_MARKUP
}
