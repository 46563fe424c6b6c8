package com.resumeparse.llm.orchestrator;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
