package com.resumeparse.core.pipeline;

import com.resumeparse.common.util.TextNormalizer;
import com.resumeparse.core.batch.BatchScheduler;
import com.resumeparse.core.fallback.FallbackExtractor;
import com.resumeparse.core.io.RecordSink;
import com.resumeparse.core.io.TextSource;
import com.resumeparse.core.model.BatchEntry;
import com.resumeparse.core.model.BatchResult;
import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.model.ExtractedCandidate;
import com.resumeparse.core.model.Outcome;
import com.resumeparse.core.model.ParseUnit;
import com.resumeparse.core.model.SourceDocument;
import com.resumeparse.core.normalize.NormalizedReply;
import com.resumeparse.core.normalize.ResponseNormalizer;
import com.resumeparse.llm.orchestrator.OrchestrationResult;
import com.resumeparse.llm.orchestrator.RequestOrchestrator;
import com.resumeparse.llm.prompt.ResumeExtractionPrompts;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for turning resume texts into candidate records.
 * <p>
 * Every operation returns one result per input, in input order, and never throws
 * for extraction problems. Failures surface as outcome tags on the affected positions.
 */
@Slf4j
public class ExtractionPipeline {
    
    private final RequestOrchestrator orchestrator;
    private final ResponseNormalizer normalizer;
    private final FallbackExtractor fallbackExtractor;
    private final PipelineConfig config;
    private final BatchScheduler scheduler;
    
    public ExtractionPipeline(RequestOrchestrator orchestrator, ResponseNormalizer normalizer,
                              FallbackExtractor fallbackExtractor, PipelineConfig config) {
        this.orchestrator = orchestrator;
        this.normalizer = normalizer;
        this.fallbackExtractor = fallbackExtractor;
        this.config = config;
        this.scheduler = new BatchScheduler(this::processChunk, config.getChunkTimeout(), config.getDispatchPause());
    }
    
    public ExtractedCandidate extract(String rawText) {
        BatchEntry entry = extractAll(List.of(rawText != null ? rawText : "")).get(0);
        return new ExtractedCandidate(0, "", entry.getRecord(), entry.getOutcome());
    }
    
    public BatchResult extractAll(List<String> rawTexts) {
        return scheduler.run(rawTexts, config.getBatchSize(), config.getMaxWorkers());
    }
    
    /**
     * Pulls every document from {@code source}, extracts them as one run and hands
     * the ordered results to {@code sink}.
     */
    public BatchResult process(TextSource source, RecordSink sink) {
        List<SourceDocument> documents;
        try {
            documents = source.documents();
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Text source failed | error={}", e.getMessage(), e);
            return BatchResult.empty();
        }
        List<String> texts = documents.stream().map(SourceDocument::getRawText).toList();
        BatchResult result = extractAll(texts);
        
        List<ExtractedCandidate> candidates = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); i++) {
            BatchEntry entry = result.get(i);
            candidates.add(new ExtractedCandidate(i, documents.get(i).getFilename(), entry.getRecord(), entry.getOutcome()));
        }
        try {
            sink.accept(candidates);
        } catch (RuntimeException e) {
            log.error("[PIPELINE] Record sink failed | candidates={} | error={}", candidates.size(), e.getMessage(), e);
        }
        
        Map<Outcome, Long> counts = result.countByOutcome();
        log.info("[PIPELINE] Documents processed | extracted={}/{} | extractionFailed={} | parseFailed={}",
            result.extractedCount(), result.size(),
            counts.get(Outcome.EXTRACTION_FAILED), counts.get(Outcome.PARSE_FAILED));
        return result;
    }
    
    List<BatchEntry> processChunk(List<ParseUnit> chunk) {
        List<BatchEntry> entries = new ArrayList<>(chunk.size());
        List<ParseUnit> pending = new ArrayList<>(chunk.size());
        for (ParseUnit unit : chunk) {
            if (unit.isBlank()) {
                entries.add(new BatchEntry(unit.getIndex(), CandidateRecord.empty(), Outcome.OK));
            } else {
                pending.add(unit);
            }
        }
        if (pending.isEmpty()) {
            return entries;
        }
        
        List<String> prepared = pending.stream().map(unit -> TextNormalizer.normalize(unit.getText())).toList();
        String prompt = ResumeExtractionPrompts.buildBatchPrompt(prepared, config.getMaxCharsPerResume());
        OrchestrationResult result = orchestrator.execute(prompt, config.getMaxAttempts());
        
        if (!result.isSuccess()) {
            log.warn("[PIPELINE] Chunk extraction failed | firstIndex={} | resumes={} | failure={} | attempts={}",
                pending.get(0).getIndex(), pending.size(), result.getFailureKind(), result.attemptCount());
            pending.forEach(unit -> entries.add(BatchEntry.failed(unit.getIndex())));
            return entries;
        }
        
        NormalizedReply reply = normalizer.normalizeReply(result.getContent(), pending.size());
        Outcome outcome = reply.isParsed() ? Outcome.OK : Outcome.PARSE_FAILED;
        for (int i = 0; i < pending.size(); i++) {
            ParseUnit unit = pending.get(i);
            CandidateRecord record = fallbackExtractor.enrich(reply.getRecords().get(i), unit.getText());
            entries.add(new BatchEntry(unit.getIndex(), record, outcome));
        }
        
        log.debug("[PIPELINE] Chunk processed | firstIndex={} | resumes={} | outcome={} | attempts={}",
            pending.get(0).getIndex(), pending.size(), outcome, result.attemptCount());
        return entries;
    }
    
    public PipelineConfig getConfig() {
        return config;
    }
}
