package com.resumeparse.core.io;

import com.resumeparse.core.model.ExtractedCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps delivered candidates in memory, across runs, in delivery order.
 */
public class CollectingRecordSink implements RecordSink {
    
    private final List<ExtractedCandidate> collected = Collections.synchronizedList(new ArrayList<>());
    
    @Override
    public void accept(List<ExtractedCandidate> candidates) {
        collected.addAll(candidates);
    }
    
    public List<ExtractedCandidate> getCollected() {
        synchronized (collected) {
            return List.copyOf(collected);
        }
    }
}
