package com.resumeparse.api.dto.response;

import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.model.Outcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {
    private Integer total;
    private Long extracted;
    private Map<String, Long> outcomes;
    private Long durationMs;
    private List<CandidateInfo> candidates;
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CandidateInfo {
        private Integer index;
        private String filename;
        private Outcome outcome;
        private CandidateRecord record;
    }
}
