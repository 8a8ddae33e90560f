package com.linlay.chatgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.chat")
public class ChatUiProperties {

    private int maxAttachedFilesSizeKb = 100;

    public int getMaxAttachedFilesSizeKb() {
        return maxAttachedFilesSizeKb;
    }

    public void setMaxAttachedFilesSizeKb(int maxAttachedFilesSizeKb) {
        this.maxAttachedFilesSizeKb = maxAttachedFilesSizeKb;
    }
}
