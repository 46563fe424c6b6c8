package com.resumeparse.core.io;

import com.resumeparse.core.model.ExtractedCandidate;

import java.util.List;

@FunctionalInterface
public interface RecordSink {
    
    /**
     * Receives every result of a run, in input order.
     */
    void accept(List<ExtractedCandidate> candidates);
}
