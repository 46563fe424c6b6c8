package com.resumeparse.core.batch;

import com.resumeparse.core.model.BatchEntry;
import com.resumeparse.core.model.ParseUnit;

import java.util.List;

/**
 * Handles one chunk of contiguous inputs. Runs on a scheduler worker thread and
 * should return promptly once that thread is interrupted.
 */
@FunctionalInterface
public interface ChunkProcessor {
    
    /**
     * @return one entry per unit, carrying the unit's index
     */
    List<BatchEntry> process(List<ParseUnit> chunk);
}
