package com.linlay.chatgateway.stream.service;

/**
 * How {@link DeltaReconciler} reacts when a cumulative observation does not extend the previous one.
 */
public enum DivergencePolicy {

    /**
     * Emit a reset signal followed by the whole new text.
     */
    EXPLICIT_RESET,

    /**
     * Emit the new text minus the longest suffix of the previous text that prefixes it.
     * Approximate: ambiguous overlaps may duplicate or drop a few characters.
     */
    LONGEST_OVERLAP
}
