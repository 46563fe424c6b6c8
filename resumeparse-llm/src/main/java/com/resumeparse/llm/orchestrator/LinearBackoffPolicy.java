package com.resumeparse.llm.orchestrator;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-kind linear backoff. Rate limits recover on a slower timescale than dropped
 * connections, so each {@link FailureKind} carries its own rule.
 */
public class LinearBackoffPolicy implements BackoffPolicy {
    
    private final Map<FailureKind, BackoffRule> rules;
    private final BackoffRule defaultRule;
    
    public LinearBackoffPolicy(Map<FailureKind, BackoffRule> rules, BackoffRule defaultRule) {
        this.rules = rules.isEmpty() ? new EnumMap<>(FailureKind.class) : new EnumMap<>(rules);
        this.defaultRule = defaultRule;
    }
    
    public static LinearBackoffPolicy defaults() {
        Map<FailureKind, BackoffRule> rules = new EnumMap<>(FailureKind.class);
        rules.put(FailureKind.RATE_LIMITED, new BackoffRule(Duration.ofSeconds(5), Duration.ofSeconds(5)));
        rules.put(FailureKind.TIMEOUT, new BackoffRule(Duration.ofSeconds(2), Duration.ofSeconds(1)));
        return new LinearBackoffPolicy(rules, new BackoffRule(Duration.ofSeconds(1), Duration.ofSeconds(1)));
    }
    
    @Override
    public Duration delayFor(FailureKind kind, int attemptNumber) {
        BackoffRule rule = kind != null ? rules.getOrDefault(kind, defaultRule) : defaultRule;
        return rule.delayFor(attemptNumber);
    }
}
