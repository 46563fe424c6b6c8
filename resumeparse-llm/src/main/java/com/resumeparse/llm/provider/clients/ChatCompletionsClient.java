package com.resumeparse.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resumeparse.llm.config.LlmProperties;
import com.resumeparse.llm.provider.CompletionClient;
import com.resumeparse.llm.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints (OpenRouter, Groq, Cerebras, SambaNova).
 */
@Slf4j
public class ChatCompletionsClient implements CompletionClient {
    
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmProvider provider;
    private final String model;
    private final int maxTokens;
    private final double temperature;
    private final Duration requestTimeout;
    private final String tag;
    
    public ChatCompletionsClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LlmProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new IllegalStateException(
                "No completion service API key configured. " +
                "Please set RESUMEPARSE_LLM_API_KEY or resumeparse.llm.api-key"
            );
        }
        this.objectMapper = objectMapper;
        this.provider = properties.resolveProvider();
        this.model = properties.resolveModel();
        this.maxTokens = properties.getMaxTokens();
        this.temperature = properties.getTemperature();
        this.requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        this.tag = "[" + provider.name() + "]";
        
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(properties.resolveBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        if (provider == LlmProvider.OPENROUTER) {
            // OpenRouter attributes traffic through these two headers
            builder.defaultHeader("HTTP-Referer", properties.getAppReferer())
                .defaultHeader("X-Title", properties.getAppTitle());
        }
        this.webClient = builder.build();
    }
    
    @Override
    public String complete(String prompt) throws CompletionException {
        long startTime = System.currentTimeMillis();
        
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        request.put("max_tokens", maxTokens);
        request.put("temperature", temperature);
        request.put("stream", false);
        
        try {
            log.debug("{} Sending request | model={} | promptLength={}", tag, model, prompt.length());
            
            String response = webClient.post()
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .block();
            
            String content = extractContent(response);
            log.debug("{} Completion received | model={} | durationMs={} | contentLength={}",
                tag, model, System.currentTimeMillis() - startTime, content.length());
            return content;
            
        } catch (WebClientResponseException e) {
            log.warn("{} HTTP error | model={} | statusCode={} | durationMs={}",
                tag, model, e.getStatusCode().value(), System.currentTimeMillis() - startTime);
            throw mapException(e);
        } catch (CompletionException e) {
            throw e;
        } catch (Exception e) {
            if (hasInterruptedCause(e)) {
                Thread.currentThread().interrupt();
            }
            log.warn("{} Request failed | model={} | durationMs={} | error={}",
                tag, model, System.currentTimeMillis() - startTime, e.getMessage());
            throw new CompletionException(
                provider.getDisplayName() + " request failed: " + e.getMessage(),
                provider, 0, null, e
            );
        }
    }
    
    private String extractContent(String response) throws CompletionException {
        if (response == null || response.isBlank()) {
            throw CompletionException.malformed(provider.getDisplayName() + " returned an empty body", provider, response, null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw CompletionException.malformed(
                "Failed to parse " + provider.getDisplayName() + " response", provider, response, e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            // Some gateways answer 200 with an error object instead of choices
            String errorMessage = root.path("error").path("message").asText("");
            int errorCode = root.path("error").path("code").asInt(200);
            if (!errorMessage.isEmpty()) {
                throw new CompletionException(errorMessage, provider, errorCode, response);
            }
            throw CompletionException.malformed(
                provider.getDisplayName() + " response has no choices[0].message.content", provider, response, null);
        }
        return content.asText();
    }
    
    private CompletionException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        String message = String.format("%s API error: %d %s", provider.getDisplayName(), status, e.getStatusText());
        
        try {
            JsonNode error = objectMapper.readTree(body);
            if (error.has("error") && error.get("error").has("message")) {
                message = error.get("error").get("message").asText();
            }
        } catch (Exception parseError) {
            log.debug("{} Error body is not JSON | statusCode={}", tag, status);
        }
        
        return new CompletionException(message, provider, status, body, e);
    }
    
    private static boolean hasInterruptedCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
    
    @Override
    public LlmProvider getProvider() {
        return provider;
    }
    
    @Override
    public String getModel() {
        return model;
    }
}
