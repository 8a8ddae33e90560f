package com.linlay.chatgateway.service;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Locale;

public final class ClientProfileClassifier {

    static final String KILOCODE_VERSION_HEADER = "x-kilocode-version";
    private static final List<String> BUFFERED_USER_AGENT_MARKERS = List.of("kilo-code", "kilocode");

    private ClientProfileClassifier() {
    }

    public static ClientProfile classify(HttpHeaders headers) {
        if (headers == null) {
            return ClientProfile.STANDARD;
        }
        if (headers.containsKey(KILOCODE_VERSION_HEADER)) {
            return ClientProfile.BUFFERED_TOOL_MARKUP;
        }
        String userAgent = headers.getFirst(HttpHeaders.USER_AGENT);
        if (userAgent != null) {
            String normalized = userAgent.toLowerCase(Locale.ROOT);
            for (String marker : BUFFERED_USER_AGENT_MARKERS) {
                if (normalized.contains(marker)) {
                    return ClientProfile.BUFFERED_TOOL_MARKUP;
                }
            }
        }
        return ClientProfile.STANDARD;
    }
}
