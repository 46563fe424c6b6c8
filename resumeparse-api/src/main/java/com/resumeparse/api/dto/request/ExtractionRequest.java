package com.resumeparse.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {
    
    @NotEmpty(message = "At least one document is required")
    @Size(max = 500, message = "At most 500 documents per request")
    private List<@Valid @NotNull Document> documents;
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Document {
        private String filename;
        
        @NotNull(message = "Document text is required")
        private String text;
    }
}
