package com.resumeparse.api.controller;

import com.resumeparse.api.dto.request.ExtractionRequest;
import com.resumeparse.api.dto.response.ExtractionResponse;
import com.resumeparse.core.io.CollectingRecordSink;
import com.resumeparse.core.io.TextSource;
import com.resumeparse.core.model.BatchResult;
import com.resumeparse.core.model.ExtractedCandidate;
import com.resumeparse.core.model.SourceDocument;
import com.resumeparse.core.pipeline.ExtractionPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/extractions")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {
    
    private final ExtractionPipeline extractionPipeline;
    
    /**
     * Extracts one candidate per submitted document. Partial failures are reported per
     * candidate through its outcome; the request itself still succeeds.
     */
    @PostMapping
    public ResponseEntity<ExtractionResponse> extract(@Valid @RequestBody ExtractionRequest request) {
        long startTime = System.currentTimeMillis();
        List<SourceDocument> documents = request.getDocuments().stream()
            .map(doc -> new SourceDocument(doc.getFilename(), doc.getText()))
            .toList();
        log.info("[API] Extraction request | documents={}", documents.size());
        
        CollectingRecordSink sink = new CollectingRecordSink();
        BatchResult result = extractionPipeline.process(TextSource.of(documents), sink);
        
        List<ExtractionResponse.CandidateInfo> candidates = sink.getCollected().stream()
            .map(this::toCandidateInfo)
            .toList();
        
        return ResponseEntity.ok(ExtractionResponse.builder()
            .total(result.size())
            .extracted(result.extractedCount())
            .outcomes(outcomeCounts(result))
            .durationMs(System.currentTimeMillis() - startTime)
            .candidates(candidates)
            .build());
    }
    
    private Map<String, Long> outcomeCounts(BatchResult result) {
        Map<String, Long> counts = new LinkedHashMap<>();
        result.countByOutcome().forEach((outcome, count) -> counts.put(outcome.getTag(), count));
        return counts;
    }
    
    private ExtractionResponse.CandidateInfo toCandidateInfo(ExtractedCandidate candidate) {
        return ExtractionResponse.CandidateInfo.builder()
            .index(candidate.getIndex())
            .filename(candidate.getFilename())
            .outcome(candidate.getOutcome())
            .record(candidate.getRecord())
            .build();
    }
}
