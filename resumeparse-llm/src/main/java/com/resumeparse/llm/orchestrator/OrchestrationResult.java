package com.resumeparse.llm.orchestrator;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link RequestOrchestrator#execute}: either the reply text or the last failure kind.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrchestrationResult {
    String content;
    FailureKind failureKind;
    List<OrchestrationAttempt> attempts;
    
    public static OrchestrationResult success(String content, List<OrchestrationAttempt> attempts) {
        return new OrchestrationResult(content, null, List.copyOf(attempts));
    }
    
    public static OrchestrationResult failure(FailureKind kind, List<OrchestrationAttempt> attempts) {
        return new OrchestrationResult(null, kind, List.copyOf(attempts));
    }
    
    public boolean isSuccess() {
        return failureKind == null;
    }
    
    public Optional<String> content() {
        return Optional.ofNullable(content);
    }
    
    public int attemptCount() {
        return attempts.size();
    }
}
