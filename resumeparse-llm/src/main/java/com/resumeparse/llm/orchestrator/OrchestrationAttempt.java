package com.resumeparse.llm.orchestrator;

import lombok.Value;

import java.time.Duration;

/**
 * One cycle of the retry loop. {@code failureKind} is null for the attempt that succeeded.
 */
@Value
public class OrchestrationAttempt {
    int attemptNumber;
    Duration elapsedWait;
    FailureKind failureKind;
    String detail;
    
    public boolean isFailure() {
        return failureKind != null;
    }
}
