package com.resumeparse.core.model;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered results of one run; entry {@code i} always belongs to input {@code i}.
 */
@Value
public class BatchResult {
    List<BatchEntry> entries;
    
    public BatchResult(List<BatchEntry> entries) {
        this.entries = List.copyOf(entries);
    }
    
    public static BatchResult empty() {
        return new BatchResult(List.of());
    }
    
    public int size() {
        return entries.size();
    }
    
    public BatchEntry get(int index) {
        return entries.get(index);
    }
    
    public List<CandidateRecord> records() {
        return entries.stream().map(BatchEntry::getRecord).toList();
    }
    
    public long extractedCount() {
        return entries.stream().filter(BatchEntry::isOk).count();
    }
    
    public Map<Outcome, Long> countByOutcome() {
        Map<Outcome, Long> counts = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            counts.put(outcome, 0L);
        }
        for (BatchEntry entry : entries) {
            counts.merge(entry.getOutcome(), 1L, Long::sum);
        }
        return counts;
    }
}
