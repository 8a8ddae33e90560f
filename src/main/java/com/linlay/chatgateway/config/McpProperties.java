package com.linlay.chatgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.mcp")
public class McpProperties {

    private long sessionTtlSeconds = 3600;
    private long sweepIntervalMs = 60_000;
    private int toolInputMinLength = 4;
    private int toolInputMaxLength = 100_000;

    public long getSessionTtlSeconds() {
        return sessionTtlSeconds;
    }

    public void setSessionTtlSeconds(long sessionTtlSeconds) {
        this.sessionTtlSeconds = sessionTtlSeconds;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public int getToolInputMinLength() {
        return toolInputMinLength;
    }

    public void setToolInputMinLength(int toolInputMinLength) {
        this.toolInputMinLength = toolInputMinLength;
    }

    public int getToolInputMaxLength() {
        return toolInputMaxLength;
    }

    public void setToolInputMaxLength(int toolInputMaxLength) {
        this.toolInputMaxLength = toolInputMaxLength;
    }
}
