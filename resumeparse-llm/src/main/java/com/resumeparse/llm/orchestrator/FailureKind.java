package com.resumeparse.llm.orchestrator;

public enum FailureKind {
    TIMEOUT,
    RATE_LIMITED,
    MALFORMED,
    NETWORK,
    UNKNOWN
}
