package com.linlay.chatgateway.config;

import com.linlay.chatgateway.controller.McpController;
import com.linlay.chatgateway.stream.service.SseFlushWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(CorsProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        List<String> origins = properties.getAllowedOrigins() == null
                ? List.of()
                : properties.getAllowedOrigins().stream().filter(StringUtils::hasText).map(String::trim).toList();
        configuration.setAllowedOriginPatterns(origins.isEmpty() ? List.of("*") : origins);
        configuration.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.POST.name(), HttpMethod.OPTIONS.name()));
        configuration.addAllowedHeader(CorsConfiguration.ALL);
        // browser clients read the conversation and MCP session ids from these
        configuration.setExposedHeaders(List.of(SseFlushWriter.CONVERSATION_HEADER, McpController.SESSION_HEADER));
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(properties.getMaxAgeSeconds());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return new CorsWebFilter(source);
    }
}
