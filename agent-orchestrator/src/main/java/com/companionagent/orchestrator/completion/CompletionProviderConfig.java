package com.companionagent.orchestrator.completion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class CompletionProviderConfig {

    @Value("${openai-compatible.groq.base-url:https://api.groq.com/openai/v1}")
    private String groqUrl;

    @Value("${openai-compatible.groq.api-key:}")
    private String groqApiKey;

    @Value("${openai-compatible.openai.base-url:https://api.openai.com/v1}")
    private String openAiUrl;

    @Value("${openai-compatible.openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai-compatible.timeout-ms:30000}")
    private long timeoutMs;

    @Bean
    public CompletionProvider groqCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new OpenAiCompatibleCompletionProvider("groq", builder, objectMapper, groqUrl, groqApiKey, timeoutMs);
    }

    @Bean
    public CompletionProvider openAiCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new OpenAiCompatibleCompletionProvider("openai", builder, objectMapper, openAiUrl, openAiApiKey, timeoutMs);
    }
}
