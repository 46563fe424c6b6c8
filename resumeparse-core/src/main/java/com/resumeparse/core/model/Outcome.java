package com.resumeparse.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a result position was produced.
 */
public enum Outcome {
    /** Remote reply parsed (or the input was blank). */
    OK("ok"),
    /** Orchestration exhausted its attempts, the chunk timed out, or the worker failed. */
    EXTRACTION_FAILED("extraction_failed"),
    /** A reply arrived but held no usable JSON; the record comes from fallback recovery alone. */
    PARSE_FAILED("parse_failed");
    
    private final String tag;
    
    Outcome(String tag) {
        this.tag = tag;
    }
    
    @JsonValue
    public String getTag() {
        return tag;
    }
}
