package com.linlay.chatgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI 兼容接口配置。未配置 apiKey 时 /v1/** 路由整体关闭。
 */
@ConfigurationProperties(prefix = "gateway.openai")
public class OpenAiProperties {

    private String apiKey;
    private String publicModelId = "1c-buddy";

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getPublicModelId() {
        return publicModelId;
    }

    public void setPublicModelId(String publicModelId) {
        this.publicModelId = publicModelId;
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }
}
