package com.resumeparse.llm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumeparse.llm.orchestrator.FailureClassifier;
import com.resumeparse.llm.orchestrator.RequestOrchestrator;
import com.resumeparse.llm.orchestrator.Sleeper;
import com.resumeparse.llm.provider.CompletionClient;
import com.resumeparse.llm.provider.clients.ChatCompletionsClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the completion client and the retrying orchestrator from {@link LlmProperties}.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
@Slf4j
public class LlmClientConfig {
    
    @Bean
    public CompletionClient completionClient(WebClient.Builder completionWebClientBuilder,
                                             ObjectMapper objectMapper,
                                             LlmProperties properties) {
        CompletionClient client = new ChatCompletionsClient(completionWebClientBuilder, objectMapper, properties);
        log.info("[LLM] Completion client configured | provider={} | model={} | timeoutSeconds={}",
            client.getProvider().getDisplayName(), client.getModel(), properties.getRequestTimeoutSeconds());
        return client;
    }
    
    @Bean
    public FailureClassifier failureClassifier(LlmProperties properties) {
        return new FailureClassifier(properties.getRateLimitPatterns());
    }
    
    @Bean
    public RequestOrchestrator requestOrchestrator(CompletionClient completionClient,
                                                   FailureClassifier failureClassifier,
                                                   LlmProperties properties) {
        return new RequestOrchestrator(
            completionClient,
            failureClassifier,
            properties.getBackoff().toPolicy(),
            Sleeper.THREAD
        );
    }
}
