package com.linlay.chatgateway.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.OpenAiProperties;
import com.linlay.chatgateway.model.openai.OpenAiErrorResponse;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Static bearer-token check for the OpenAI-compatible routes. Without a configured key those routes do not exist.
 */
@Component
public class GatewayApiKeyWebFilter implements WebFilter {

    private static final String PROTECTED_PREFIX = "/v1/";
    private static final String BEARER = "bearer";

    private final OpenAiProperties openAiProperties;
    private final ObjectMapper objectMapper;

    public GatewayApiKeyWebFilter(OpenAiProperties openAiProperties, ObjectMapper objectMapper) {
        this.openAiProperties = openAiProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!StringUtils.hasText(path) || !path.startsWith(PROTECTED_PREFIX)) {
            return chain.filter(exchange);
        }
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }
        if (!openAiProperties.isEnabled()) {
            return writeError(exchange, HttpStatus.NOT_FOUND,
                    OpenAiErrorResponse.of("Not found", "invalid_request_error", HttpStatus.NOT_FOUND.value()));
        }
        String token = resolveBearerToken(exchange.getRequest().getHeaders().getFirst("Authorization"));
        if (token == null || !matches(token, openAiProperties.getApiKey())) {
            return writeError(exchange, HttpStatus.UNAUTHORIZED,
                    OpenAiErrorResponse.of("Invalid or missing API key", "authentication_error", HttpStatus.UNAUTHORIZED.value()));
        }
        return chain.filter(exchange);
    }

    static String resolveBearerToken(String authorization) {
        if (!StringUtils.hasText(authorization)) {
            return null;
        }
        String[] parts = authorization.trim().split("\\s+");
        if (parts.length != 2 || !BEARER.equalsIgnoreCase(parts[0])) {
            return null;
        }
        return parts[1];
    }

    private boolean matches(String token, String expected) {
        return MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private Mono<Void> writeError(ServerWebExchange exchange, HttpStatus status, OpenAiErrorResponse error) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException ex) {
            return Mono.error(ex);
        }
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
