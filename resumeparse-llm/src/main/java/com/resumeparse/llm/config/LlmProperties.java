package com.resumeparse.llm.config;

import com.resumeparse.llm.orchestrator.BackoffRule;
import com.resumeparse.llm.orchestrator.FailureKind;
import com.resumeparse.llm.orchestrator.LinearBackoffPolicy;
import com.resumeparse.llm.provider.LlmProvider;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "resumeparse.llm")
@Getter
@Setter
public class LlmProperties {
    private String provider = LlmProvider.OPENROUTER.name();
    private String apiKey;
    private String model; // falls back to the provider default
    private String baseUrl; // falls back to the provider endpoint
    private int maxTokens = 3000;
    private double temperature = 0.1;
    private int requestTimeoutSeconds = 60;
    private int connectTimeoutMillis = 10_000;
    private String appReferer = "https://github.com/resumeparse";
    private String appTitle = "Resume Parser";
    private List<String> rateLimitPatterns = new ArrayList<>(List.of(
        "rate limit", "rate_limit", "ratelimit", "too many requests", "quota exceeded"
    ));
    private Backoff backoff = new Backoff();
    
    public LlmProvider resolveProvider() {
        return LlmProvider.fromString(provider);
    }
    
    public String resolveModel() {
        return model != null && !model.isBlank() ? model : resolveProvider().getDefaultModel();
    }
    
    public String resolveBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank() ? baseUrl : resolveProvider().getBaseUrl();
    }
    
    @Getter
    @Setter
    public static class Backoff {
        private long rateLimitBaseMs = 5_000;
        private long rateLimitStepMs = 5_000;
        private long timeoutBaseMs = 2_000;
        private long timeoutStepMs = 1_000;
        private long defaultBaseMs = 1_000;
        private long defaultStepMs = 1_000;
        
        public LinearBackoffPolicy toPolicy() {
            BackoffRule fallback = rule(defaultBaseMs, defaultStepMs);
            Map<FailureKind, BackoffRule> rules = new EnumMap<>(FailureKind.class);
            rules.put(FailureKind.RATE_LIMITED, rule(rateLimitBaseMs, rateLimitStepMs));
            rules.put(FailureKind.TIMEOUT, rule(timeoutBaseMs, timeoutStepMs));
            return new LinearBackoffPolicy(rules, fallback);
        }
        
        private static BackoffRule rule(long baseMs, long stepMs) {
            return new BackoffRule(Duration.ofMillis(baseMs), Duration.ofMillis(stepMs));
        }
    }
}
