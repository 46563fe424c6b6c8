package com.resumeparse.llm.orchestrator;

/**
 * States of one {@link RequestOrchestrator#execute} call.
 * ATTEMPTING and BACKING_OFF alternate until SUCCEEDED or EXHAUSTED.
 */
public enum OrchestratorState {
    ATTEMPTING,
    BACKING_OFF,
    SUCCEEDED,
    EXHAUSTED;
    
    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
