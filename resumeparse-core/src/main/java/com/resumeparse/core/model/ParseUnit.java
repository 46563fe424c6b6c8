package com.resumeparse.core.model;

import lombok.Value;

/**
 * One input text and its position in the batch.
 */
@Value
public class ParseUnit {
    int index;
    String text;
    
    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
