package com.linlay.chatgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.log")
public class UpstreamLogProperties {

    private boolean enabled;
    private boolean maskSensitive = true;
    private int requestBodyMaxLength = 40_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public int getRequestBodyMaxLength() {
        return requestBodyMaxLength;
    }

    public void setRequestBodyMaxLength(int requestBodyMaxLength) {
        this.requestBodyMaxLength = requestBodyMaxLength;
    }
}
