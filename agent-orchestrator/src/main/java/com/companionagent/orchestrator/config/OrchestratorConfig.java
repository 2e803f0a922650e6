package com.companionagent.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class OrchestratorConfig {

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.memory.base-url}")
    private String memoryUrl;

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.baseUrl(notificationUrl).build();
    }

    @Bean
    public WebClient memoryClient(WebClient.Builder builder) {
        return builder.baseUrl(memoryUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
