package com.linlay.chatgateway.config;

import com.linlay.chatgateway.service.LogSanitizer;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 上游 HTTP 客户端装配：连接池、连接超时与可选的请求/响应日志过滤器。
 * <p>
 * SSE 读取不设读超时，连接阶段使用 {@code gateway.upstream.timeout-seconds}。
 */
@Configuration
public class UpstreamClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClientConfiguration.class);

    @Bean
    public ConnectionProvider upstreamConnectionProvider() {
        return ConnectionProvider.builder("upstream-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder upstreamWebClientBuilder(
            UpstreamProperties upstreamProperties,
            UpstreamLogProperties logProperties,
            ConnectionProvider upstreamConnectionProvider) {
        int connectTimeoutMs = (int) Duration.ofSeconds(Math.max(1, upstreamProperties.getTimeoutSeconds())).toMillis();
        HttpClient httpClient = HttpClient.create(upstreamConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs);

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (!logProperties.isEnabled()) {
            return builder;
        }

        boolean maskSensitive = logProperties.isMaskSensitive();
        return builder.filter((request, next) -> {
            log.debug("[upstream-webclient][request] {} {}", request.method(), request.url());
            log.debug("[upstream-webclient][request-headers] {}", LogSanitizer.maskHeaders(request.headers(), maskSensitive));
            return next.exchange(request)
                    .doOnNext(logResponse(maskSensitive, request));
        });
    }

    private Consumer<ClientResponse> logResponse(boolean maskSensitive, ClientRequest request) {
        return response -> {
            log.info(
                    "[upstream-webclient][response] {} {} status={}",
                    request.method(),
                    request.url(),
                    response.statusCode().value()
            );
            log.debug("[upstream-webclient][response-headers] {}", LogSanitizer.maskHeaders(response.headers().asHttpHeaders(), maskSensitive));
        };
    }
}
