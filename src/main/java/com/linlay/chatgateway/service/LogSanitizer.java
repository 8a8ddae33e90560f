package com.linlay.chatgateway.service;

import org.springframework.http.HttpHeaders;

import java.util.List;

/**
 * 日志脱敏工具。
 * <p>
 * Authorization 只保留认证方案（上游令牌没有方案，整体替换），Cookie 与 Set-Cookie 整体隐藏，过长正文截断。
 */
public final class LogSanitizer {

    static final String MASKED_CREDENTIAL = "****";
    static final String REDACTED = "<redacted>";
    private static final String TRUNCATED_SUFFIX = "...(truncated)";

    private LogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        safeHeaders.putAll(headers);
        if (!maskSensitive) {
            return safeHeaders;
        }
        String authorization = safeHeaders.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null) {
            safeHeaders.set(HttpHeaders.AUTHORIZATION, maskAuthorization(authorization));
        }
        for (String key : List.of(HttpHeaders.COOKIE, HttpHeaders.SET_COOKIE)) {
            if (safeHeaders.containsKey(key)) {
                safeHeaders.set(key, REDACTED);
            }
        }
        return safeHeaders;
    }

    static String maskAuthorization(String value) {
        String[] parts = value.trim().split("\\s+");
        return parts.length > 1 ? parts[0] + " " + MASKED_CREDENTIAL : MASKED_CREDENTIAL;
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text == null ? "" : text;
        }
        return text.substring(0, maxLength) + TRUNCATED_SUFFIX;
    }
}
