package com.plantwatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Shared by the chat-bot, chat-webhook and generic webhook adapters
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder,
                                     @Value("${garden.notifications.http.connect-timeout:5s}") Duration connectTimeout,
                                     @Value("${garden.notifications.http.read-timeout:10s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
