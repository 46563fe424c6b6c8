package com.resumeparse.core.model;

import lombok.Value;

@Value
public class SourceDocument {
    String filename;
    String rawText;
}
