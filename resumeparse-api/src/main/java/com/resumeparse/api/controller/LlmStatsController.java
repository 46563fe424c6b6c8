package com.resumeparse.api.controller;

import com.resumeparse.core.pipeline.ExtractionPipeline;
import com.resumeparse.core.pipeline.PipelineConfig;
import com.resumeparse.llm.orchestrator.RequestOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmStatsController {
    
    private final RequestOrchestrator requestOrchestrator;
    private final ExtractionPipeline extractionPipeline;
    
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        PipelineConfig config = extractionPipeline.getConfig();
        
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("provider", requestOrchestrator.getClient().getProvider().getDisplayName());
        stats.put("model", requestOrchestrator.getClient().getModel());
        stats.put("totalCalls", requestOrchestrator.getCallCount());
        stats.put("maxAttempts", config.getMaxAttempts());
        stats.put("batchSize", config.getBatchSize());
        stats.put("maxWorkers", config.getMaxWorkers());
        stats.put("chunkTimeoutSeconds", config.getChunkTimeout().toSeconds());
        return ResponseEntity.ok(stats);
    }
}
