package com.resumeparse.llm.orchestrator;

import com.resumeparse.llm.provider.CompletionClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one logical completion request with retries.
 *
 * The loop is a small state machine: ATTEMPTING sends the prompt and either SUCCEEDS or
 * moves to BACKING_OFF (or EXHAUSTED on the last attempt); BACKING_OFF waits according to
 * the {@link BackoffPolicy} for the classified {@link FailureKind} and returns to ATTEMPTING.
 * No exception leaves {@link #execute}; callers always receive an {@link OrchestrationResult}.
 *
 * Instances are safe to share between threads. The only mutable field is a diagnostic call
 * counter that is never consulted for control decisions.
 */
@Slf4j
public class RequestOrchestrator {
    
    private final CompletionClient client;
    private final FailureClassifier classifier;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    
    private final AtomicLong callCounter = new AtomicLong(0);
    
    public RequestOrchestrator(CompletionClient client, FailureClassifier classifier,
                               BackoffPolicy backoffPolicy, Sleeper sleeper) {
        this.client = client;
        this.classifier = classifier;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
    }
    
    public OrchestrationResult execute(String prompt, int maxAttempts) {
        if (prompt == null || prompt.isBlank() || maxAttempts < 1) {
            log.warn("[ORCHESTRATOR] Rejected request | promptBlank={} | maxAttempts={}",
                prompt == null || prompt.isBlank(), maxAttempts);
            return OrchestrationResult.failure(FailureKind.UNKNOWN, List.of());
        }
        
        long callId = callCounter.incrementAndGet();
        long startTime = System.currentTimeMillis();
        List<OrchestrationAttempt> history = new ArrayList<>();
        
        OrchestratorState state = OrchestratorState.ATTEMPTING;
        int attempt = 0;
        FailureKind lastFailure = FailureKind.UNKNOWN;
        String lastDetail = null;
        String content = null;
        
        log.debug("[ORCHESTRATOR] Starting request | callId={} | provider={} | promptLength={} | maxAttempts={}",
            callId, client.getProvider().getDisplayName(), prompt.length(), maxAttempts);
        
        while (!state.isTerminal()) {
            switch (state) {
                case ATTEMPTING:
                    attempt++;
                    try {
                        String reply = client.complete(prompt);
                        if (reply != null && !reply.isBlank()) {
                            content = reply;
                            history.add(new OrchestrationAttempt(attempt, Duration.ZERO, null, null));
                            state = OrchestratorState.SUCCEEDED;
                            break;
                        }
                        lastFailure = FailureKind.MALFORMED;
                        lastDetail = "empty completion content";
                    } catch (RuntimeException e) {
                        lastFailure = classifier.classify(e);
                        lastDetail = e.getMessage();
                    }
                    
                    log.warn("[ORCHESTRATOR] Attempt failed | callId={} | attempt={}/{} | kind={} | error={}",
                        callId, attempt, maxAttempts, lastFailure, lastDetail);
                    
                    if (Thread.currentThread().isInterrupted()) {
                        history.add(new OrchestrationAttempt(attempt, Duration.ZERO, lastFailure, lastDetail));
                        log.warn("[ORCHESTRATOR] Interrupted, abandoning request | callId={} | attempt={}", callId, attempt);
                        state = OrchestratorState.EXHAUSTED;
                    } else if (attempt >= maxAttempts) {
                        history.add(new OrchestrationAttempt(attempt, Duration.ZERO, lastFailure, lastDetail));
                        state = OrchestratorState.EXHAUSTED;
                    } else {
                        state = OrchestratorState.BACKING_OFF;
                    }
                    break;
                    
                case BACKING_OFF:
                    Duration delay = backoffPolicy.delayFor(lastFailure, attempt);
                    history.add(new OrchestrationAttempt(attempt, delay, lastFailure, lastDetail));
                    log.info("[ORCHESTRATOR] Backing off | callId={} | attempt={} | kind={} | delayMs={}",
                        callId, attempt, lastFailure, delay.toMillis());
                    try {
                        sleeper.sleep(delay);
                        state = OrchestratorState.ATTEMPTING;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("[ORCHESTRATOR] Interrupted during backoff | callId={} | attempt={}", callId, attempt);
                        state = OrchestratorState.EXHAUSTED;
                    }
                    break;
                    
                default:
                    state = OrchestratorState.EXHAUSTED;
            }
        }
        
        long duration = System.currentTimeMillis() - startTime;
        if (state == OrchestratorState.SUCCEEDED) {
            log.info("[ORCHESTRATOR] Request succeeded | callId={} | attempts={} | durationMs={} | responseLength={}",
                callId, attempt, duration, content.length());
            return OrchestrationResult.success(content, history);
        }
        
        log.error("[ORCHESTRATOR] Request exhausted | callId={} | attempts={} | lastKind={} | durationMs={} | lastError={}",
            callId, attempt, lastFailure, duration, lastDetail);
        return OrchestrationResult.failure(lastFailure, history);
    }
    
    public long getCallCount() {
        return callCounter.get();
    }
    
    public CompletionClient getClient() {
        return client;
    }
}
