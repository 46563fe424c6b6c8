package com.resumeparse.core.batch;

import com.resumeparse.core.model.BatchEntry;
import com.resumeparse.core.model.BatchResult;
import com.resumeparse.core.model.ParseUnit;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Splits inputs into contiguous chunks and runs them on a bounded worker pool.
 * <p>
 * Each chunk is timed from the moment a worker picks it up. A chunk that runs past
 * {@code chunkTimeout}, or fails in any way, yields empty {@code EXTRACTION_FAILED}
 * entries for its own positions only. Results are assembled back into input order.
 */
@Slf4j
public class BatchScheduler {
    
    private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();
    
    private final ChunkProcessor chunkProcessor;
    private final Duration chunkTimeout;
    private final Duration dispatchPause;
    
    public BatchScheduler(ChunkProcessor chunkProcessor, Duration chunkTimeout, Duration dispatchPause) {
        this.chunkProcessor = chunkProcessor;
        this.chunkTimeout = chunkTimeout;
        this.dispatchPause = dispatchPause == null ? Duration.ZERO : dispatchPause;
    }
    
    public BatchResult run(List<String> inputs, int batchSize, int maxWorkers) {
        if (inputs == null || inputs.isEmpty()) {
            return BatchResult.empty();
        }
        int size = Math.max(1, batchSize);
        int workers = Math.max(1, maxWorkers);
        List<List<ParseUnit>> chunks = partition(inputs, size);
        String runId = "run-" + RUN_SEQUENCE.incrementAndGet();
        long startTime = System.currentTimeMillis();
        
        log.info("[BATCH] Run started | runId={} | inputs={} | chunks={} | batchSize={} | workers={}",
            runId, inputs.size(), chunks.size(), size, workers);
        
        BatchEntry[] slots = new BatchEntry[inputs.size()];
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, chunks.size()), namedThreads(runId + "-worker"));
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads(runId + "-watchdog"));
        List<CompletableFuture<List<BatchEntry>>> outcomes = new ArrayList<>(chunks.size());
        
        try {
            for (int c = 0; c < chunks.size(); c++) {
                if (c > 0 && !dispatchPause.isZero()) {
                    Thread.sleep(dispatchPause.toMillis());
                }
                outcomes.add(dispatch(runId, c, chunks.get(c), pool, watchdog));
            }
            for (int c = 0; c < chunks.size(); c++) {
                place(collect(runId, c, chunks.get(c), outcomes.get(c)), chunks.get(c), slots);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[BATCH] Run interrupted | runId={} | dispatched={}/{}", runId, outcomes.size(), chunks.size());
            outcomes.forEach(outcome -> outcome.cancel(true));
        } finally {
            pool.shutdownNow();
            watchdog.shutdownNow();
        }
        
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                slots[i] = BatchEntry.failed(i);
            }
        }
        BatchResult result = new BatchResult(Arrays.asList(slots));
        log.info("[BATCH] Run completed | runId={} | extracted={}/{} | timeMs={}",
            runId, result.extractedCount(), result.size(), System.currentTimeMillis() - startTime);
        return result;
    }
    
    private CompletableFuture<List<BatchEntry>> dispatch(String runId, int chunkNumber, List<ParseUnit> chunk,
                                                         ExecutorService pool, ScheduledExecutorService watchdog) {
        CompletableFuture<List<BatchEntry>> outcome = new CompletableFuture<>();
        AtomicReference<Future<?>> task = new AtomicReference<>();
        
        task.set(pool.submit(() -> {
            ScheduledFuture<?> alarm = watchdog.schedule(() -> {
                if (outcome.complete(failedEntries(chunk))) {
                    log.warn("[BATCH] Chunk timed out | runId={} | chunk={} | timeoutMs={}",
                        runId, chunkNumber, chunkTimeout.toMillis());
                    Future<?> running = task.get();
                    if (running != null) {
                        running.cancel(true);
                    }
                }
            }, chunkTimeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                outcome.complete(chunkProcessor.process(chunk));
            } catch (RuntimeException e) {
                log.error("[BATCH] Chunk failed | runId={} | chunk={} | error={}", runId, chunkNumber, e.getMessage(), e);
                outcome.complete(failedEntries(chunk));
            } finally {
                alarm.cancel(false);
                outcome.complete(failedEntries(chunk));
            }
        }));
        return outcome;
    }
    
    private List<BatchEntry> collect(String runId, int chunkNumber, List<ParseUnit> chunk,
                                     CompletableFuture<List<BatchEntry>> outcome) throws InterruptedException {
        try {
            List<BatchEntry> entries = outcome.get();
            return entries != null ? entries : failedEntries(chunk);
        } catch (ExecutionException e) {
            log.error("[BATCH] Chunk result unavailable | runId={} | chunk={} | error={}",
                runId, chunkNumber, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return failedEntries(chunk);
        }
    }
    
    private void place(List<BatchEntry> entries, List<ParseUnit> chunk, BatchEntry[] slots) {
        int first = chunk.get(0).getIndex();
        int last = chunk.get(chunk.size() - 1).getIndex();
        for (BatchEntry entry : entries) {
            if (entry != null && entry.getIndex() >= first && entry.getIndex() <= last) {
                slots[entry.getIndex()] = entry;
            }
        }
    }
    
    private static List<BatchEntry> failedEntries(List<ParseUnit> chunk) {
        return chunk.stream().map(unit -> BatchEntry.failed(unit.getIndex())).toList();
    }
    
    static List<List<ParseUnit>> partition(List<String> inputs, int size) {
        List<List<ParseUnit>> chunks = new ArrayList<>();
        for (int start = 0; start < inputs.size(); start += size) {
            int end = Math.min(start + size, inputs.size());
            List<ParseUnit> chunk = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                String text = inputs.get(i);
                chunk.add(new ParseUnit(i, text != null ? text : ""));
            }
            chunks.add(chunk);
        }
        return chunks;
    }
    
    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
