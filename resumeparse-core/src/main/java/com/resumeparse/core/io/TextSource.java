package com.resumeparse.core.io;

import com.resumeparse.core.model.SourceDocument;

import java.util.List;

/**
 * Supplies documents to extract. Text is treated as opaque; format conversion
 * happens before a document reaches this interface.
 */
public interface TextSource {
    
    List<SourceDocument> documents();
    
    static TextSource of(List<SourceDocument> documents) {
        List<SourceDocument> copy = List.copyOf(documents);
        return () -> copy;
    }
}
