package com.resumeparse.llm.orchestrator;

import lombok.Value;

import java.time.Duration;

/**
 * Linear delay: {@code base + attemptNumber * step}.
 */
@Value
public class BackoffRule {
    Duration base;
    Duration step;
    
    public Duration delayFor(int attemptNumber) {
        return base.plus(step.multipliedBy(Math.max(0, attemptNumber)));
    }
}
