package com.resumeparse.core.model;

import lombok.Value;

@Value
public class BatchEntry {
    int index;
    CandidateRecord record;
    Outcome outcome;
    
    public static BatchEntry failed(int index) {
        return new BatchEntry(index, CandidateRecord.empty(), Outcome.EXTRACTION_FAILED);
    }
    
    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
