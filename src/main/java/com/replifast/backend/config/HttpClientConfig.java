package com.replifast.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Shared RestTemplate for Google and Anthropic calls. Timeouts are bounded because
 * these calls run inside user requests.
 */
@Configuration
@EnableConfigurationProperties(HttpClientConfig.HttpProperties.class)
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, HttpProperties httpProperties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(httpProperties.connectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(httpProperties.readTimeoutMs()))
                .build();
    }

    @ConfigurationProperties(prefix = "app.http")
    public record HttpProperties(
            @DefaultValue("5000") int connectTimeoutMs,
            @DefaultValue("15000") int readTimeoutMs
    ) {
    }
}
