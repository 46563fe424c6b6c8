package com.resumeparse.llm.orchestrator;

import java.time.Duration;

/**
 * Decides how long to wait after a failed attempt before the next one.
 */
@FunctionalInterface
public interface BackoffPolicy {
    
    Duration delayFor(FailureKind kind, int attemptNumber);
}
