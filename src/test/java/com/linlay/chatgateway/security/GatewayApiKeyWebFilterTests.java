package com.linlay.chatgateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.config.OpenAiProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayApiKeyWebFilterTests {

    private final AtomicBoolean chainCalled = new AtomicBoolean();
    private final WebFilterChain chain = exchange -> {
        chainCalled.set(true);
        return Mono.empty();
    };

    @Test
    void shouldPassThroughRoutesOutsideOpenAiPrefix() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/mcp").build());

        filter("secret").filter(exchange, chain).block();

        assertThat(chainCalled).isTrue();
        assertThat(exchange.getResponse().getStatusCode()).isNull();
    }

    @Test
    void shouldHideOpenAiRoutesWhenNoKeyConfigured() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/v1/models").header(HttpHeaders.AUTHORIZATION, "Bearer anything").build());

        filter("  ").filter(exchange, chain).block();

        assertThat(chainCalled).isFalse();
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(exchange.getResponse().getBodyAsString().block()).contains("\"message\":\"Not found\"");
    }

    @Test
    void shouldRejectWrongKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.post("/v1/chat/completions").header(HttpHeaders.AUTHORIZATION, "Bearer nope").build());

        filter("secret").filter(exchange, chain).block();

        assertThat(chainCalled).isFalse();
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block())
                .contains("\"type\":\"authentication_error\"")
                .contains("\"code\":401");
    }

    @Test
    void shouldAcceptMatchingKeyCaseInsensitiveScheme() {
        MockServerWebExchange exchange = MockServerWebExchange.from(
                MockServerHttpRequest.get("/v1/models").header(HttpHeaders.AUTHORIZATION, "BEARER secret").build());

        filter("secret").filter(exchange, chain).block();

        assertThat(chainCalled).isTrue();
    }

    @Test
    void shouldLetPreflightThrough() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.options("/v1/models").build());

        filter("secret").filter(exchange, chain).block();

        assertThat(chainCalled).isTrue();
    }

    @Test
    void shouldParseBearerHeader() {
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken("Bearer abc")).isEqualTo("abc");
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken("  bearer   abc  ")).isEqualTo("abc");
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken("Basic abc")).isNull();
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken("Bearer")).isNull();
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken("Bearer a b")).isNull();
        assertThat(GatewayApiKeyWebFilter.resolveBearerToken(null)).isNull();
    }

    private GatewayApiKeyWebFilter filter(String apiKey) {
        OpenAiProperties properties = new OpenAiProperties();
        properties.setApiKey(apiKey);
        return new GatewayApiKeyWebFilter(properties, new ObjectMapper());
    }
}
