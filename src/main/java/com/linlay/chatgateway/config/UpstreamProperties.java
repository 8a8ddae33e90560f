package com.linlay.chatgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.upstream")
public class UpstreamProperties {

    private String baseUrl = "https://code.1c.ai";
    private String token;
    private int timeoutSeconds = 30;
    private String uiLanguage = "russian";
    private String programmingLanguage = "";
    private int inputMaxLength = 100_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getUiLanguage() {
        return uiLanguage;
    }

    public void setUiLanguage(String uiLanguage) {
        this.uiLanguage = uiLanguage;
    }

    public String getProgrammingLanguage() {
        return programmingLanguage;
    }

    public void setProgrammingLanguage(String programmingLanguage) {
        this.programmingLanguage = programmingLanguage == null ? "" : programmingLanguage;
    }

    public int getInputMaxLength() {
        return inputMaxLength;
    }

    public void setInputMaxLength(int inputMaxLength) {
        this.inputMaxLength = inputMaxLength;
    }
}
